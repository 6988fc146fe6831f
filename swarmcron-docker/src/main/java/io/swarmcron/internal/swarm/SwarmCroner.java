package io.swarmcron.internal.swarm;

import io.swarmcron.Croner;
import io.swarmcron.ExecutionAggregator;
import io.swarmcron.ObjectClient;
import io.swarmcron.TriggerEngine;
import io.swarmcron.TriggerHandle;
import io.swarmcron.config.SwarmCronProperties;
import io.swarmcron.core.JobDefinition;
import io.swarmcron.core.JobDetails;
import io.swarmcron.core.LabelFilter;
import io.swarmcron.core.RescheduleResult;
import io.swarmcron.core.RunCommand;
import io.swarmcron.exception.JobNotFoundException;
import io.swarmcron.exception.JobRemovalException;
import io.swarmcron.exception.JobValidationException;
import io.swarmcron.exception.RunObjectCreationException;
import io.swarmcron.exception.ScheduleException;
import io.swarmcron.exception.SwarmCronException;
import io.swarmcron.internal.RunCommandBuilder;
import io.swarmcron.utils.Schedule;
import io.swarmcron.utils.ScheduleParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Docker Swarm backed scheduler.
 *
 * <p>The only in-process state is the map of active triggers; job definitions live in the labels
 * of the services each firing creates. Each firing runs {@code docker service create} for a
 * one-shot service ({@code --restart-condition none}), so every run leaves an object whose tasks
 * form the execution history.
 */
public class SwarmCroner implements Croner, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SwarmCroner.class);

    private final ObjectClient objectClient;
    private final RunCommandBuilder commandBuilder;
    private final LabelJobRegistry jobRegistry;
    private final ExecutionAggregator executionAggregator;
    private final TriggerEngine triggerEngine;
    private final ZoneId zone;

    private final ConcurrentHashMap<String, TriggerHandle> triggers = new ConcurrentHashMap<>();

    public SwarmCroner(SwarmCronProperties props,
                       ObjectClient objectClient,
                       RunCommandBuilder commandBuilder,
                       LabelJobRegistry jobRegistry,
                       ExecutionAggregator executionAggregator,
                       TriggerEngine triggerEngine) {
        Objects.requireNonNull(props, "props must not be null");
        this.objectClient = Objects.requireNonNull(objectClient, "objectClient must not be null");
        this.commandBuilder = Objects.requireNonNull(commandBuilder, "commandBuilder must not be null");
        this.jobRegistry = Objects.requireNonNull(jobRegistry, "jobRegistry must not be null");
        this.executionAggregator = Objects.requireNonNull(executionAggregator, "executionAggregator must not be null");
        this.triggerEngine = Objects.requireNonNull(triggerEngine, "triggerEngine must not be null");
        this.zone = props.zoneId();
    }

    @Override
    public void addJob(JobDefinition job) {
        RunCommand command = commandBuilder.render(job);
        String name = job.name();

        if (!job.isRecurring()) {
            TriggerHandle previous = triggers.remove(name);
            if (previous != null) {
                previous.cancel();
                log.info("swarmcron job trigger cancelled, job is now one-shot name={}", name);
            }
            String objectId = create(name, command);
            log.info("swarmcron one-shot job started name={} objectId={}", name, objectId);
            return;
        }

        Schedule schedule;
        TriggerHandle handle;
        try {
            schedule = ScheduleParser.parse(job.schedule(), zone);
            handle = triggerEngine.schedule(name, schedule, () -> fire(name, command));
        } catch (IllegalArgumentException e) {
            throw new ScheduleException(job.schedule(), e);
        }

        triggers.compute(name, (k, previous) -> {
            if (previous != null) {
                previous.cancel();
                log.info("swarmcron job trigger replaced name={}", name);
            }
            return handle;
        });
        log.info("swarmcron job scheduled name={} schedule={}", name, job.schedule());
    }

    @Override
    public void removeJob(String name) {
        if (name == null || name.isBlank()) {
            throw new JobValidationException("job name must not be blank");
        }

        TriggerHandle handle = triggers.remove(name);
        if (handle != null) {
            handle.cancel();
        }

        try {
            objectClient.removeObjects(LabelFilter.job(name));
        } catch (RuntimeException e) {
            throw new JobRemovalException(name, e);
        }
        log.info("swarmcron job removed name={} hadTrigger={}", name, handle != null);
    }

    @Override
    public Map<String, JobDefinition> getJobs() {
        return jobRegistry.listJobs();
    }

    @Override
    public JobDetails getJob(String name) {
        if (name == null || name.isBlank()) {
            throw new JobValidationException("job name must not be blank");
        }
        JobDefinition job = jobRegistry.findJob(name)
                .orElseThrow(() -> new JobNotFoundException(name));
        return new JobDetails(job, executionAggregator.listExecutions(name));
    }

    @Override
    public RescheduleResult rescheduleJobs() {
        Map<String, JobDefinition> jobs = getJobs();

        List<String> rescheduled = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Map<String, RuntimeException> failures = new LinkedHashMap<>();

        for (JobDefinition job : jobs.values()) {
            if (!job.isRecurring() || triggers.containsKey(job.name())) {
                skipped.add(job.name());
                continue;
            }
            try {
                addJob(job);
                rescheduled.add(job.name());
            } catch (SwarmCronException e) {
                failures.put(job.name(), e);
                log.warn("swarmcron could not reschedule job name={} msg={}", job.name(), e.getMessage());
            }
        }

        log.info("swarmcron rescheduled jobs count={} skipped={} failed={}",
                rescheduled.size(), skipped.size(), failures.size());
        return new RescheduleResult(rescheduled, skipped, failures);
    }

    @Override
    public Set<String> scheduledJobNames() {
        return Set.copyOf(triggers.keySet());
    }

    @Override
    public void stop() {
        int cancelled = 0;
        for (String name : triggers.keySet()) {
            TriggerHandle handle = triggers.remove(name);
            if (handle != null) {
                handle.cancel();
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("swarmcron stopped, cancelled triggers count={}", cancelled);
        }
    }

    /**
     * Stop, then release the trigger engine's threads.
     */
    @Override
    public void close() {
        stop();
        triggerEngine.shutdown();
    }

    private String create(String name, RunCommand command) {
        try {
            return objectClient.createRunObject(command);
        } catch (RuntimeException e) {
            throw new RunObjectCreationException(name, e);
        }
    }

    private void fire(String name, RunCommand command) {
        try {
            String objectId = objectClient.createRunObject(command);
            log.info("swarmcron job fired name={} objectId={}", name, objectId);
        } catch (Exception e) {
            log.error("swarmcron job firing failed name={} msg={}", name, e.getMessage(), e);
        }
    }
}
