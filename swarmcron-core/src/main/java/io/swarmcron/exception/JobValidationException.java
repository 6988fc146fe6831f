package io.swarmcron.exception;

/**
 * Thrown when a job definition is rejected before anything is registered or created.
 */
public class JobValidationException extends SwarmCronException {
    public JobValidationException(String message) {
        super(message);
    }

    public JobValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
