package dev.craftnudge.exception;

/**
 * The entity store refused a write on a constraint that no concurrent writer
 * explains (value too long, missing reference). Permanent for the dispatcher:
 * the same attributes are refused again on every attempt.
 */
public class StoreRejectedException extends RuntimeException {
    public StoreRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
