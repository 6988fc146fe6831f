package io.swarmcron.exception;

/**
 * Base type of every error raised by the scheduler.
 */
public class SwarmCronException extends RuntimeException {
    public SwarmCronException(String message) {
        super(message);
    }

    public SwarmCronException(String message, Throwable cause) {
        super(message, cause);
    }
}
