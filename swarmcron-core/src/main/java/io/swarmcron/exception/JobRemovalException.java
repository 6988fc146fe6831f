package io.swarmcron.exception;

/**
 * Thrown when the run objects of a job could not be removed.
 */
public class JobRemovalException extends SwarmCronException {
    public JobRemovalException(String jobName, Throwable cause) {
        super("Could not remove objects of job " + jobName + ": " + cause.getMessage(), cause);
    }
}
