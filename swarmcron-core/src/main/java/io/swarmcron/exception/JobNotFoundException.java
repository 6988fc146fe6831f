package io.swarmcron.exception;

public class JobNotFoundException extends SwarmCronException {

    private final String jobName;

    public JobNotFoundException(String jobName) {
        super("Could not find the job " + jobName);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
