package heterosched.engine.executor;

import heterosched.engine.model.TaskDescriptor;

/**
 * Failure of a single task's work.
 * Policies recover from it locally; it never aborts a batch.
 */
public class WorkExecutionException extends Exception {

    private final int taskId;

    public WorkExecutionException(TaskDescriptor task, String message) {
        super(message);
        this.taskId = task.id();
    }

    public WorkExecutionException(TaskDescriptor task, String message, Throwable cause) {
        super(message, cause);
        this.taskId = task.id();
    }

    public int taskId() {
        return taskId;
    }
}
