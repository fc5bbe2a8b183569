package heterosched.engine.policy;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.executor.WorkExecutor;
import heterosched.engine.model.TaskDescriptor;
import heterosched.engine.model.TaskType;
import heterosched.engine.recorder.ExecutionRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one type at a time in a fixed order, with a full barrier between types:
 * no task of a later tier starts before every task of the earlier tier has finished.
 */
public abstract class TieredPolicy extends AbstractSchedulingPolicy {

    private static final Logger log = LoggerFactory.getLogger(TieredPolicy.class);

    protected TieredPolicy(SchedulerConfig config, ExecutionRecorder recorder) {
        super(config, recorder);
    }

    /** Types in submission order. */
    protected abstract List<TaskType> tierOrder();

    /**
     * The non-empty tiers of a batch in submission order.
     */
    public List<List<TaskDescriptor>> tiers(List<TaskDescriptor> tasks) {
        Map<TaskType, List<TaskDescriptor>> groups = groupByType(tasks);
        List<List<TaskDescriptor>> tiers = new ArrayList<>();
        for (TaskType type : tierOrder()) {
            List<TaskDescriptor> group = groups.get(type);
            if (group == null || group.isEmpty()) {
                log.debug("{}: no {} tasks, skipping tier", name(), type.label());
                continue;
            }
            tiers.add(group);
        }
        return tiers;
    }

    @Override
    protected void schedule(List<TaskDescriptor> tasks, WorkExecutor executor, RunTally tally)
            throws InterruptedException {
        try (WorkerPool pool = newPool("pool", config.workerCount(), 0)) {
            for (List<TaskDescriptor> tier : tiers(tasks)) {
                log.info("{}: executing {} {} tasks", name(), tier.size(), tier.get(0).type().label());
                runGroup(pool, tier, executor, tally);
            }
        }
    }
}
