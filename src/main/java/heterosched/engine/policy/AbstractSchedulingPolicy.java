package heterosched.engine.policy;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.executor.WorkExecutionException;
import heterosched.engine.executor.WorkExecutor;
import heterosched.engine.model.ExecutionSummary;
import heterosched.engine.model.TaskDescriptor;
import heterosched.engine.model.TaskType;
import heterosched.engine.recorder.ExecutionRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Future;

/**
 * Shared run loop for all policies.
 *
 * Handles the empty batch, timing and the summary; every task goes through
 * {@link #runTask} so that its record is opened and closed and its outcome
 * counted whatever the executor does.
 */
public abstract class AbstractSchedulingPolicy implements SchedulingPolicy {

    private static final Logger log = LoggerFactory.getLogger(AbstractSchedulingPolicy.class);

    protected final SchedulerConfig config;
    protected final ExecutionRecorder recorder;

    protected AbstractSchedulingPolicy(SchedulerConfig config, ExecutionRecorder recorder) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.recorder = Objects.requireNonNull(recorder, "recorder is required");
    }

    @Override
    public final ExecutionSummary run(List<TaskDescriptor> tasks, WorkExecutor executor) {
        Objects.requireNonNull(tasks, "tasks is required");
        Objects.requireNonNull(executor, "executor is required");

        if (tasks.isEmpty()) {
            log.info("{}: no tasks to schedule", name());
            return ExecutionSummary.empty(name());
        }

        log.info("{}: scheduling {} tasks on {} workers", name(), tasks.size(), config.workerCount());

        RunTally tally = new RunTally();
        long start = System.nanoTime();
        try {
            schedule(tasks, executor, tally);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{}: interrupted, summary covers finished tasks only", name());
        }
        Duration wallClock = Duration.ofNanos(System.nanoTime() - start);

        ExecutionSummary summary = new ExecutionSummary(
                name(), tally.completed(), tally.failed(), tasks.size(), wallClock);
        log.info("{}: {} completed, {} failed, {} total in {}ms",
                name(), summary.completed(), summary.failed(), summary.total(), wallClock.toMillis());
        return summary;
    }

    /**
     * Submit the non-empty batch and wait until every submitted task has finished.
     */
    protected abstract void schedule(List<TaskDescriptor> tasks, WorkExecutor executor, RunTally tally)
            throws InterruptedException;

    /**
     * Execute one task on the calling worker, recording start and end.
     * Never throws for task failures.
     */
    protected void runTask(TaskDescriptor task, WorkExecutor executor, RunTally tally) {
        int workerId = WorkerPool.currentWorkerId();
        recorder.recordStart(task.id(), workerId, task.type());
        boolean failed = true;
        try {
            log.debug("Worker {} executing task {} ({})", workerId, task.id(), task.type().label());
            executor.execute(task);
            failed = false;
        } catch (WorkExecutionException e) {
            log.warn("Task {} ({}) failed: {}", task.id(), task.type().label(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Task {} ({}) failed unexpectedly", task.id(), task.type().label(), e);
        } finally {
            recorder.recordEnd(task.id(), workerId, failed);
            tally.record(failed);
        }
    }

    /**
     * Submit a group and wait for all of it to finish.
     */
    protected void runGroup(WorkerPool pool, List<TaskDescriptor> group, WorkExecutor executor, RunTally tally)
            throws InterruptedException {
        List<Future<?>> futures = new ArrayList<>(group.size());
        for (TaskDescriptor task : group) {
            futures.add(pool.submit(() -> runTask(task, executor, tally)));
        }
        GroupBarrier.waitForGroup(futures);
    }

    protected WorkerPool newPool(String suffix, int size, int firstWorkerId) {
        return new WorkerPool(name() + "-" + suffix, size, firstWorkerId, config.shutdownTimeout());
    }

    /**
     * Partition by type, keeping generated order within each type.
     */
    protected static Map<TaskType, List<TaskDescriptor>> groupByType(List<TaskDescriptor> tasks) {
        Map<TaskType, List<TaskDescriptor>> groups = new EnumMap<>(TaskType.class);
        for (TaskDescriptor task : tasks) {
            groups.computeIfAbsent(task.type(), k -> new ArrayList<>()).add(task);
        }
        return groups;
    }
}
