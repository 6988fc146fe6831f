package io.swarmcron;

import io.swarmcron.core.ExecutionRecord;

import java.util.List;

/**
 * Computes the execution history of a job from its run objects and their tasks.
 * Nothing is cached; every call queries the orchestrator.
 */
public interface ExecutionAggregator {

    /**
     * One record per task of every run object labelled with {@code jobName}, in the order the
     * objects were listed. All-or-nothing: any listing failure discards the partial result.
     *
     * @throws io.swarmcron.exception.JobNotFoundException when no object carries the name
     * @throws io.swarmcron.exception.JobQueryException    when an object or task listing fails
     */
    List<ExecutionRecord> listExecutions(String jobName);
}
