package dev.craftnudge.exception;

/**
 * Notification signature did not verify. Rejected at the boundary, never retried.
 */
public class AuthenticationFailedException extends RuntimeException {
    public AuthenticationFailedException(String message) {
        super(message);
    }
}
