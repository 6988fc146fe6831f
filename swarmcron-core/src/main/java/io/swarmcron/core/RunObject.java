package io.swarmcron.core;

import java.time.Instant;
import java.util.Map;

/**
 * Orchestrator object created for one firing of a job.
 */
public record RunObject(
        String id,
        Map<String, String> labels,
        RunSpec runSpec,
        Instant createdAt
) {
    public RunObject {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    public String label(String key) {
        return labels.get(key);
    }
}
