package io.swarmcron;

import io.swarmcron.core.LabelFilter;
import io.swarmcron.core.RunCommand;
import io.swarmcron.core.RunObject;
import io.swarmcron.core.RunTask;

import java.util.List;

/**
 * Thin client over the orchestrator's object store.
 *
 * <p>Every call is a blocking remote call and is not retried. Implementations report failures
 * with {@link io.swarmcron.exception.ObjectClientException}; callers translate them.
 */
public interface ObjectClient {

    /**
     * Create a run object from a rendered command.
     *
     * @return identifier of the created object
     */
    String createRunObject(RunCommand command);

    /**
     * List objects carrying every label of {@code filter}, in orchestrator order.
     */
    List<RunObject> listObjects(LabelFilter filter);

    /**
     * Remove every object carrying every label of {@code filter}. Matching nothing is not an error.
     */
    void removeObjects(LabelFilter filter);

    /**
     * List the tasks of a single object.
     */
    List<RunTask> listTasks(String objectId);
}
