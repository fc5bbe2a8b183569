package heterosched.engine.policy;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.model.TaskType;
import heterosched.engine.recorder.ExecutionRecorder;

import java.util.List;

/**
 * Ranks types by the configured priority order (Compute, Memory, Mixed, IO by
 * default) and drains each tier before the next.
 */
public class PriorityTieredPolicy extends TieredPolicy {

    public PriorityTieredPolicy(SchedulerConfig config, ExecutionRecorder recorder) {
        super(config, recorder);
    }

    @Override
    public PolicyType type() {
        return PolicyType.PRIORITY;
    }

    @Override
    protected List<TaskType> tierOrder() {
        return config.priorityOrder();
    }

    /** Rank of a type, 0 being the highest priority. */
    public int rank(TaskType type) {
        return config.priorityOrder().indexOf(type);
    }
}
