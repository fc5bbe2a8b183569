package heterosched.engine.policy;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.model.TaskType;
import heterosched.engine.recorder.ExecutionRecorder;

import java.util.List;

/**
 * Groups tasks by type and drains each group before submitting the next,
 * in Compute, Memory, IO, Mixed order.
 */
public class GroupedPolicy extends TieredPolicy {

    private static final List<TaskType> ORDER = List.of(TaskType.values());

    public GroupedPolicy(SchedulerConfig config, ExecutionRecorder recorder) {
        super(config, recorder);
    }

    @Override
    public PolicyType type() {
        return PolicyType.GROUPED;
    }

    @Override
    protected List<TaskType> tierOrder() {
        return ORDER;
    }
}
