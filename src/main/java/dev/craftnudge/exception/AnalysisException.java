package dev.craftnudge.exception;

/**
 * Failure reported by the analysis engine for a single commit.
 */
public abstract class AnalysisException extends RuntimeException {
    protected AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
