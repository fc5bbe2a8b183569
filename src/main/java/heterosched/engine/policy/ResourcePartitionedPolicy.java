package heterosched.engine.policy;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.executor.WorkExecutor;
import heterosched.engine.model.TaskDescriptor;
import heterosched.engine.model.TaskType;
import heterosched.engine.recorder.ExecutionRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Splits the worker budget into per-type sub-budgets and runs each type's
 * tasks on a pool of exactly that size, one type after another.
 *
 * Types with a configured share get {@code floor(workers * share)} workers;
 * types without one split what is left. Every budget is at least 1, so with
 * few workers the budgets can add up to more than the worker count.
 */
public class ResourcePartitionedPolicy extends AbstractSchedulingPolicy {

    private static final Logger log = LoggerFactory.getLogger(ResourcePartitionedPolicy.class);

    public ResourcePartitionedPolicy(SchedulerConfig config, ExecutionRecorder recorder) {
        super(config, recorder);
    }

    @Override
    public PolicyType type() {
        return PolicyType.PARTITIONED;
    }

    /**
     * Worker budget per type for the configured worker count.
     */
    public Map<TaskType, Integer> budgets() {
        int workers = config.workerCount();
        Map<TaskType, Double> shares = config.partitionShares();
        Map<TaskType, Integer> budgets = new EnumMap<>(TaskType.class);

        int assigned = 0;
        int unshared = 0;
        for (TaskType type : TaskType.values()) {
            Double share = shares.get(type);
            if (share == null) {
                unshared++;
                continue;
            }
            int budget = Math.max(1, (int) Math.floor(workers * share));
            budgets.put(type, budget);
            assigned += budget;
        }

        if (unshared > 0) {
            int each = Math.max(1, (workers - assigned) / unshared);
            for (TaskType type : TaskType.values()) {
                budgets.putIfAbsent(type, each);
            }
        }
        return budgets;
    }

    @Override
    protected void schedule(List<TaskDescriptor> tasks, WorkExecutor executor, RunTally tally)
            throws InterruptedException {
        Map<TaskType, Integer> budgets = budgets();
        Map<TaskType, List<TaskDescriptor>> groups = groupByType(tasks);
        log.info("{}: worker budgets {}", name(), budgets);

        int firstWorkerId = 0;
        for (TaskType type : TaskType.values()) {
            int budget = budgets.get(type);
            List<TaskDescriptor> group = groups.get(type);
            if (group == null || group.isEmpty()) {
                log.debug("{}: no {} tasks, skipping", name(), type.label());
                firstWorkerId += budget;
                continue;
            }

            log.info("{}: executing {} {} tasks on {} workers", name(), group.size(), type.label(), budget);
            try (WorkerPool pool = newPool(type.label().toLowerCase(), budget, firstWorkerId)) {
                runGroup(pool, group, executor, tally);
            }
            firstWorkerId += budget;
        }
    }
}
