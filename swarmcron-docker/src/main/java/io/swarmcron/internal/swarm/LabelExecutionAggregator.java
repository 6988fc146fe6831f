package io.swarmcron.internal.swarm;

import io.swarmcron.ExecutionAggregator;
import io.swarmcron.ObjectClient;
import io.swarmcron.core.ExecutionRecord;
import io.swarmcron.core.LabelFilter;
import io.swarmcron.core.RunObject;
import io.swarmcron.core.RunTask;
import io.swarmcron.exception.JobNotFoundException;
import io.swarmcron.exception.JobQueryException;
import io.swarmcron.exception.JobValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class LabelExecutionAggregator implements ExecutionAggregator {

    private final ObjectClient objectClient;

    public LabelExecutionAggregator(ObjectClient objectClient) {
        this.objectClient = Objects.requireNonNull(objectClient, "objectClient must not be null");
    }

    @Override
    public List<ExecutionRecord> listExecutions(String jobName) {
        if (jobName == null || jobName.isBlank()) {
            throw new JobValidationException("job name must not be blank");
        }

        List<RunObject> objects;
        try {
            objects = objectClient.listObjects(LabelFilter.job(jobName));
        } catch (RuntimeException e) {
            throw new JobQueryException("Could not list objects of job " + jobName + ": " + e.getMessage(), e);
        }
        if (objects.isEmpty()) {
            throw new JobNotFoundException(jobName);
        }

        List<ExecutionRecord> executions = new ArrayList<>();
        for (RunObject object : objects) {
            List<RunTask> tasks;
            try {
                tasks = objectClient.listTasks(object.id());
            } catch (RuntimeException e) {
                throw new JobQueryException("Could not list tasks of object " + object.id() + ": " + e.getMessage(), e);
            }
            for (RunTask task : tasks) {
                executions.add(new ExecutionRecord(task.createdAt(), task.status(), object.id(), task.id()));
            }
        }
        return List.copyOf(executions);
    }
}
