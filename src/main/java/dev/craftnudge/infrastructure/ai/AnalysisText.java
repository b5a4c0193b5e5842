package dev.craftnudge.infrastructure.ai;

/**
 * Successful engine output and the model that produced it.
 */
public record AnalysisText(String text, String model) {
    public AnalysisText {
        if (text == null || text.isBlank()) throw new IllegalArgumentException("analysis text required");
    }
}
