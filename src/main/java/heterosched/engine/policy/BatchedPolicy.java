package heterosched.engine.policy;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.executor.WorkExecutor;
import heterosched.engine.model.TaskDescriptor;
import heterosched.engine.recorder.ExecutionRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Submits fixed-size batches in generated order and drains each batch before
 * the next one. Batch size is {@code workers * batchFactor}.
 */
public class BatchedPolicy extends AbstractSchedulingPolicy {

    private static final Logger log = LoggerFactory.getLogger(BatchedPolicy.class);

    public BatchedPolicy(SchedulerConfig config, ExecutionRecorder recorder) {
        super(config, recorder);
    }

    @Override
    public PolicyType type() {
        return PolicyType.BATCHED;
    }

    public int batchSize() {
        return config.workerCount() * config.batchFactor();
    }

    @Override
    protected void schedule(List<TaskDescriptor> tasks, WorkExecutor executor, RunTally tally)
            throws InterruptedException {
        int batchSize = batchSize();
        try (WorkerPool pool = newPool("pool", config.workerCount(), 0)) {
            for (int from = 0; from < tasks.size(); from += batchSize) {
                List<TaskDescriptor> batch = tasks.subList(from, Math.min(from + batchSize, tasks.size()));
                log.debug("{}: batch of {} starting at {}", name(), batch.size(), from);
                runGroup(pool, batch, executor, tally);
            }
        }
    }
}
