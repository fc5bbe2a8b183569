package heterosched.engine.executor;

import heterosched.engine.model.TaskDescriptor;

/**
 * Performs the actual work for a task.
 * Implementations may run for any bounded time and may be called from many
 * workers at once.
 */
@FunctionalInterface
public interface WorkExecutor {

    /**
     * @throws WorkExecutionException if the task's work fails
     */
    void execute(TaskDescriptor task) throws WorkExecutionException;
}
