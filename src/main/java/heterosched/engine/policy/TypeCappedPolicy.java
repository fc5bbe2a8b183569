package heterosched.engine.policy;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.executor.WorkExecutor;
import heterosched.engine.governor.ConcurrencyGovernor;
import heterosched.engine.model.TaskDescriptor;
import heterosched.engine.model.TaskType;
import heterosched.engine.recorder.ExecutionRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single pass in generated order with a concurrency cap per type.
 *
 * A type with divisor {@code d} may have at most {@code max(1, workers / d)}
 * tasks in flight; types without a divisor are uncapped. Admission happens on
 * the submitting thread, so a full type holds back the tasks behind it.
 */
public class TypeCappedPolicy extends AbstractSchedulingPolicy {

    private static final Logger log = LoggerFactory.getLogger(TypeCappedPolicy.class);

    private final Map<TaskType, ConcurrencyGovernor> governors = new EnumMap<>(TaskType.class);

    public TypeCappedPolicy(SchedulerConfig config, ExecutionRecorder recorder) {
        super(config, recorder);
        for (TaskType type : TaskType.values()) {
            governors.put(type, new ConcurrencyGovernor(type.label().toLowerCase() + "-cap", cap(type)));
        }
    }

    @Override
    public PolicyType type() {
        return PolicyType.CAPPED;
    }

    /** In-flight limit of a type. */
    public int cap(TaskType type) {
        Integer divisor = config.typeCapDivisors().get(type);
        if (divisor == null || divisor <= 0) {
            return Integer.MAX_VALUE;
        }
        return Math.max(1, config.workerCount() / divisor);
    }

    public ConcurrencyGovernor governor(TaskType type) {
        return governors.get(type);
    }

    @Override
    protected void schedule(List<TaskDescriptor> tasks, WorkExecutor executor, RunTally tally)
            throws InterruptedException {
        governors.values().forEach(ConcurrencyGovernor::resetPeak);

        List<GovernedTask> submitted = new ArrayList<>(tasks.size());
        List<Future<?>> futures = new ArrayList<>(tasks.size());

        WorkerPool pool = newPool("pool", config.workerCount(), 0);
        try {
            for (TaskDescriptor task : tasks) {
                ConcurrencyGovernor governor = governors.get(task.type());
                governor.admit();
                GovernedTask governed = new GovernedTask(governor, () -> runTask(task, executor, tally));
                try {
                    futures.add(pool.submit(governed));
                } catch (RejectedExecutionException e) {
                    governed.abandon();
                    throw e;
                }
                submitted.add(governed);
            }
            GroupBarrier.waitForGroup(futures);
        } finally {
            pool.shutdown();
            for (GovernedTask governed : submitted) {
                governed.abandon();
            }
        }

        for (TaskType type : TaskType.values()) {
            log.debug("{}: {} peak in flight {}", name(), type.label(), governors.get(type).peakAdmitted());
        }
    }
}
