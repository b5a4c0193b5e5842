package dev.craftnudge.exception;

/**
 * The entity store could not be reached. Transient for the dispatcher, which
 * retries the whole event.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
