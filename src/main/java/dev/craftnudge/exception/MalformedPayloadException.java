package dev.craftnudge.exception;

/**
 * Payload could not be normalized into commits. Permanent: retrying the same
 * bytes can only fail the same way.
 */
public class MalformedPayloadException extends RuntimeException {
    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
