package dev.craftnudge.domain.valueobject;

import dev.craftnudge.domain.enums.AnalysisStatus;

import java.time.Duration;

/**
 * What one analysis attempt produced. A failed outcome is either retryable
 * (timeout, rate limit) or permanent.
 */
public record AnalysisOutcome(AnalysisStatus status, String text, String errorMessage,
                              boolean retryable, String model, Duration duration) {

    public static AnalysisOutcome success(String text, String model, Duration duration) {
        return new AnalysisOutcome(AnalysisStatus.OK, text, null, false, model, duration);
    }

    public static AnalysisOutcome transientFailure(String error, Duration duration) {
        return new AnalysisOutcome(AnalysisStatus.FAILED, null, error, true, null, duration);
    }

    public static AnalysisOutcome permanentFailure(String error, Duration duration) {
        return new AnalysisOutcome(AnalysisStatus.FAILED, null, error, false, null, duration);
    }

    public boolean isSuccess() {
        return status == AnalysisStatus.OK;
    }

    /** OK, or FAILED for a reason a retry won't fix. */
    public boolean isTerminal() {
        return isSuccess() || !retryable;
    }
}
