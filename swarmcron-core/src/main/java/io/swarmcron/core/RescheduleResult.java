package io.swarmcron.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of replaying reconstructed jobs into the scheduler.
 *
 * rescheduled : jobs that got a new trigger
 * skipped     : jobs left alone (no schedule, or a trigger was already active)
 * failures    : jobs whose re-registration failed, with the cause
 */
public record RescheduleResult(
        List<String> rescheduled,
        List<String> skipped,
        Map<String, RuntimeException> failures
) {

    public RescheduleResult {
        rescheduled = List.copyOf(rescheduled);
        skipped = List.copyOf(skipped);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
