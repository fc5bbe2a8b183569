package heterosched.engine.policy;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.controller.AdaptiveController;
import heterosched.engine.executor.WorkExecutor;
import heterosched.engine.governor.ConcurrencyGovernor;
import heterosched.engine.model.ControllerTick;
import heterosched.engine.model.TaskDescriptor;
import heterosched.engine.recorder.ExecutionRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single pass over the batch with admission control.
 *
 * Each task is admitted by the governor before it is submitted and releases
 * its slot when it finishes. An {@link AdaptiveController} runs alongside and
 * moves the governor's ceiling according to throughput and occupancy; it is
 * stopped cooperatively once every task has finished.
 */
public class AdaptivePolicy extends AbstractSchedulingPolicy {

    private static final Logger log = LoggerFactory.getLogger(AdaptivePolicy.class);

    private final ConcurrencyGovernor governor;

    private volatile List<ControllerTick> lastHistory = List.of();

    public AdaptivePolicy(SchedulerConfig config, ExecutionRecorder recorder, ConcurrencyGovernor governor) {
        super(config, recorder);
        this.governor = governor;
    }

    @Override
    public PolicyType type() {
        return PolicyType.ADAPTIVE;
    }

    public ConcurrencyGovernor governor() {
        return governor;
    }

    /** Controller ticks of the most recent run. */
    public List<ControllerTick> lastHistory() {
        return lastHistory;
    }

    @Override
    protected void schedule(List<TaskDescriptor> tasks, WorkExecutor executor, RunTally tally)
            throws InterruptedException {
        governor.setCeiling(config.initialCeiling());
        governor.resetPeak();

        List<GovernedTask> submitted = new ArrayList<>(tasks.size());
        List<Future<?>> futures = new ArrayList<>(tasks.size());

        AdaptiveController controller = new AdaptiveController(recorder, governor, config);
        WorkerPool pool = newPool("pool", config.workerCount(), 0);
        controller.start();
        try {
            for (TaskDescriptor task : tasks) {
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
            controller.close();
            lastHistory = controller.history();
            log.info("{}: final ceiling {}, peak admitted {}, {} controller ticks",
                    name(), governor.ceiling(), governor.peakAdmitted(), lastHistory.size());
        }
    }
}
