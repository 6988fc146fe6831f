package io.swarmcron;

import io.swarmcron.core.JobDefinition;
import io.swarmcron.core.JobDetails;
import io.swarmcron.core.RescheduleResult;

import java.util.Map;
import java.util.Set;

/**
 * Main scheduler API.
 *
 * <p>Jobs are not stored anywhere but on the orchestrator: every run object carries labels
 * describing the job that created it, and {@link #rescheduleJobs()} rebuilds the in-memory
 * triggers from those labels after a restart.
 *
 * <p>Typical usage:
 * <pre>{@code
 * croner.rescheduleJobs();
 *
 * croner.addJob(JobDefinition.builder()
 *         .name("nightly-backup")
 *         .image("alpine")
 *         .command("echo backup")
 *         .schedule("0 0 2 * * *")
 *         .build());
 *
 * croner.removeJob("nightly-backup");
 * croner.stop();
 * }</pre>
 */
public interface Croner {

    /**
     * Register a job. A non-empty schedule installs a recurring trigger (replacing any trigger
     * already registered under the same name); an empty schedule cancels any trigger registered
     * under the name and runs the job once, right away.
     */
    void addJob(JobDefinition job);

    /**
     * Cancel the trigger of the named job, if any, then remove all of its run objects.
     * Removing an unknown job is not an error.
     */
    void removeJob(String name);

    /**
     * Reconstruct every known job from the labels of the run objects on the orchestrator.
     */
    Map<String, JobDefinition> getJobs();

    /**
     * Resolve a single job together with its execution history.
     */
    JobDetails getJob(String name);

    /**
     * Re-register triggers for every reconstructed job that has a schedule and no active trigger.
     * Must run once at startup, before new jobs are accepted.
     */
    RescheduleResult rescheduleJobs();

    /**
     * Names of jobs that currently own an active trigger.
     */
    Set<String> scheduledJobNames();

    /**
     * Cancel every registered trigger. Idempotent.
     */
    void stop();
}
