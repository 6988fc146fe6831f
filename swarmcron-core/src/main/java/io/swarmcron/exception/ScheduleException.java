package io.swarmcron.exception;

/**
 * Thrown when a schedule expression cannot be turned into a trigger.
 */
public class ScheduleException extends SwarmCronException {

    private final String schedule;

    public ScheduleException(String schedule, Throwable cause) {
        super("Invalid schedule '" + schedule + "': " + cause.getMessage(), cause);
        this.schedule = schedule;
    }

    public String getSchedule() {
        return schedule;
    }
}
