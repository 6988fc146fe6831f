package io.swarmcron.core;

import java.time.Instant;

/**
 * Read-only summary of one task of a run object. Computed on demand, never stored.
 *
 * createdAt     : task creation time
 * status        : orchestrator task state (e.g. "complete", "failed", "running")
 * runIdentifier : id of the run object the task belongs to
 * taskId        : id of the task itself
 */
public record ExecutionRecord(
        Instant createdAt,
        String status,
        String runIdentifier,
        String taskId
) {
}
