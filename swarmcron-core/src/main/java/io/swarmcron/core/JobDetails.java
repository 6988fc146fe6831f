package io.swarmcron.core;

import java.util.List;

/**
 * A job together with its execution history.
 */
public record JobDetails(
        JobDefinition job,
        List<ExecutionRecord> executions
) {
    public JobDetails {
        executions = executions == null ? List.of() : List.copyOf(executions);
    }
}
