package io.swarmcron.exception;

/**
 * Thrown when a one-shot job could not create its run object.
 */
public class RunObjectCreationException extends SwarmCronException {
    public RunObjectCreationException(String jobName, Throwable cause) {
        super("Could not create run object for job " + jobName + ": " + cause.getMessage(), cause);
    }
}
