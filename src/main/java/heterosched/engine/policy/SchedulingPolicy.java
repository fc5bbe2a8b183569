package heterosched.engine.policy;

import heterosched.engine.executor.WorkExecutor;
import heterosched.engine.model.ExecutionSummary;
import heterosched.engine.model.TaskDescriptor;

import java.util.List;

/**
 * Strategy deciding in what order and grouping tasks reach the workers.
 */
public interface SchedulingPolicy {

    PolicyType type();

    /**
     * Run every task of the batch and return once all of them have finished.
     * Task failures are counted, never thrown.
     */
    ExecutionSummary run(List<TaskDescriptor> tasks, WorkExecutor executor);

    default String name() {
        return type().selector();
    }
}
