package io.swarmcron.exception;

/**
 * Failure reported by an {@code ObjectClient} implementation.
 */
public class ObjectClientException extends SwarmCronException {
    public ObjectClientException(String message) {
        super(message);
    }

    public ObjectClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
