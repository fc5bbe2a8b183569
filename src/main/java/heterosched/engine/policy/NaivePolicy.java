package heterosched.engine.policy;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.executor.WorkExecutor;
import heterosched.engine.model.TaskDescriptor;
import heterosched.engine.recorder.ExecutionRecorder;

import java.util.List;

/**
 * Submits every task at once in generated order; each runs as soon as a worker is free.
 */
public class NaivePolicy extends AbstractSchedulingPolicy {

    public NaivePolicy(SchedulerConfig config, ExecutionRecorder recorder) {
        super(config, recorder);
    }

    @Override
    public PolicyType type() {
        return PolicyType.NAIVE;
    }

    @Override
    protected void schedule(List<TaskDescriptor> tasks, WorkExecutor executor, RunTally tally)
            throws InterruptedException {
        try (WorkerPool pool = newPool("pool", config.workerCount(), 0)) {
            runGroup(pool, tasks, executor, tally);
        }
    }
}
