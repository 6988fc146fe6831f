package io.swarmcron.internal.swarm;

import io.swarmcron.ObjectClient;
import io.swarmcron.core.JobDefinition;
import io.swarmcron.core.LabelFilter;
import io.swarmcron.core.RunObject;
import io.swarmcron.exception.JobQueryException;
import io.swarmcron.internal.RunCommandBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rebuilds job definitions from the labels of run objects.
 *
 * <p>A recurring job accumulates one object per firing, so several objects can decode to the same
 * name. The most recently created object wins; when creation times are equal or unknown, the
 * object listed last wins.
 */
public class LabelJobRegistry {
    private static final Logger log = LoggerFactory.getLogger(LabelJobRegistry.class);

    private final ObjectClient objectClient;
    private final RunCommandBuilder commandBuilder;

    private record Candidate(JobDefinition job, Instant createdAt) {
    }

    public LabelJobRegistry(ObjectClient objectClient, RunCommandBuilder commandBuilder) {
        this.objectClient = Objects.requireNonNull(objectClient, "objectClient must not be null");
        this.commandBuilder = Objects.requireNonNull(commandBuilder, "commandBuilder must not be null");
    }

    /**
     * Full scan of every object carrying the marker label.
     *
     * @return jobs keyed by name, in the order their first object was listed; may be empty
     * @throws JobQueryException if the listing fails
     */
    public Map<String, JobDefinition> listJobs() {
        List<RunObject> objects = query(LabelFilter.marker(), "Could not list jobs");
        Map<String, JobDefinition> jobs = resolve(objects);
        log.debug("swarmcron reconstructed jobs count={} fromObjects={}", jobs.size(), objects.size());
        return jobs;
    }

    /**
     * Resolve a single job from the objects labelled with its name.
     *
     * @throws JobQueryException if the listing fails
     */
    public Optional<JobDefinition> findJob(String name) {
        Objects.requireNonNull(name, "name must not be null");
        List<RunObject> objects = query(LabelFilter.job(name), "Could not find job " + name);
        return Optional.ofNullable(resolve(objects).get(name));
    }

    private List<RunObject> query(LabelFilter filter, String message) {
        try {
            return objectClient.listObjects(filter);
        } catch (RuntimeException e) {
            throw new JobQueryException(message + ": " + e.getMessage(), e);
        }
    }

    private Map<String, JobDefinition> resolve(List<RunObject> objects) {
        Map<String, Candidate> byName = new LinkedHashMap<>();
        for (RunObject object : objects) {
            Optional<JobDefinition> decoded = commandBuilder.decode(object);
            if (decoded.isEmpty()) {
                continue;
            }
            JobDefinition job = decoded.get();
            Candidate existing = byName.get(job.name());
            if (existing == null || !isOlder(object.createdAt(), existing.createdAt())) {
                if (existing != null && !sameParameters(existing.job(), job)) {
                    log.warn("swarmcron job definition diverges between objects name={} keeping objectId={}",
                            job.name(), object.id());
                }
                byName.put(job.name(), new Candidate(job, object.createdAt()));
            }
        }

        Map<String, JobDefinition> jobs = new LinkedHashMap<>();
        byName.forEach((name, candidate) -> jobs.put(name, candidate.job()));
        return Collections.unmodifiableMap(jobs);
    }

    private static boolean isOlder(Instant candidate, Instant current) {
        if (candidate == null) {
            return current != null;
        }
        return current != null && candidate.isBefore(current);
    }

    private static boolean sameParameters(JobDefinition a, JobDefinition b) {
        return a.schedule().equals(b.schedule())
                && a.command().equals(b.command())
                && a.args().equals(b.args());
    }
}
