package dev.craftnudge.exception;

/**
 * The engine rejected the input. Recorded as a failed result and not retried.
 */
public class AnalysisPermanentException extends AnalysisException {
    public AnalysisPermanentException(String message) {
        super(message, null);
    }

    public AnalysisPermanentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
