package dev.craftnudge.exception;

/**
 * Timeout, rate limit or unavailable model. Only the affected commit's analysis is retried.
 */
public class AnalysisTransientException extends AnalysisException {
    public AnalysisTransientException(String message) {
        super(message, null);
    }

    public AnalysisTransientException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
