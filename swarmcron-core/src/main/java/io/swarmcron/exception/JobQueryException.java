package io.swarmcron.exception;

/**
 * Thrown when listing run objects or their tasks fails.
 */
public class JobQueryException extends SwarmCronException {
    public JobQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
