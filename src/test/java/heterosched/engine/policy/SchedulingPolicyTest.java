package heterosched.engine.policy;

import heterosched.engine.config.Dependencies;
import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.executor.WorkExecutor;
import heterosched.engine.model.ExecutionRecord;
import heterosched.engine.model.ExecutionSummary;
import heterosched.engine.model.TaskDescriptor;
import heterosched.engine.model.TaskType;
import heterosched.engine.recorder.ExecutionRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties every policy must hold.
 */
class SchedulingPolicyTest {

    private static final int WORKERS = 3;

    private Dependencies deps;
    private ExecutionRecorder recorder;

    @BeforeEach
    void setUp() {
        deps = Dependencies.create(SchedulerConfig.defaults()
                .withWorkerCount(WORKERS)
                .withControllerInterval(Duration.ofMillis(50)));
        recorder = deps.recorder();
    }

    @Test
    @DisplayName("Every task of the batch ends with exactly one closed record")
    void everyPolicyRunsEveryTask() {
        List<TaskDescriptor> tasks = PolicyFixtures.mixedBatch(5, 5);

        for (PolicyType type : PolicyType.values()) {
            recorder.reset();
            ExecutionSummary summary = deps.policy(type).run(tasks, PolicyFixtures.sleeping());

            assertEquals(tasks.size(), summary.total(), type.selector());
            assertEquals(tasks.size(), summary.completed(), type.selector());
            assertEquals(0, summary.failed(), type.selector());
            assertEquals(type.selector(), summary.policy());

            List<ExecutionRecord> records = recorder.records();
            assertEquals(tasks.size(), records.size(), type.selector());
            assertEquals(0, recorder.openCount(), type.selector());
            Set<Integer> ids = records.stream().map(ExecutionRecord::taskId).collect(Collectors.toSet());
            assertEquals(tasks.size(), ids.size(), type.selector());
        }
    }

    @Test
    void emptyBatchGivesZeroSummary() {
        for (PolicyType type : PolicyType.values()) {
            ExecutionSummary summary = deps.policy(type).run(List.of(), PolicyFixtures.sleeping());

            assertEquals(0, summary.completed());
            assertEquals(0, summary.failed());
            assertEquals(0, summary.total());
            assertTrue(recorder.records().isEmpty());
        }
    }

    @Test
    void singleTypeBatchSkipsOtherTypes() {
        List<TaskDescriptor> tasks = PolicyFixtures.batchOf(TaskType.MEMORY, 4, 0, 1);

        for (PolicyType type : PolicyType.values()) {
            recorder.reset();
            ExecutionSummary summary = deps.policy(type).run(tasks, PolicyFixtures.sleeping());
            assertEquals(4, summary.completed(), type.selector());
        }
    }

    @Test
    @DisplayName("Runtime exceptions from the executor count as failures")
    void runtimeExceptionsAreFailures() {
        WorkExecutor executor = task -> {
            if (task.type() == TaskType.MEMORY) {
                throw new IllegalStateException("boom");
            }
        };
        List<TaskDescriptor> tasks = PolicyFixtures.mixedBatch(3, 0);

        for (PolicyType type : PolicyType.values()) {
            recorder.reset();
            ExecutionSummary summary = deps.policy(type).run(tasks, executor);

            assertEquals(9, summary.completed(), type.selector());
            assertEquals(3, summary.failed(), type.selector());
            assertEquals(0, recorder.openCount(), type.selector());
        }
    }

    @Test
    void workerIdsStayWithinPool() {
        List<TaskDescriptor> tasks = PolicyFixtures.mixedBatch(6, 2);

        deps.policy(PolicyType.NAIVE).run(tasks, PolicyFixtures.sleeping());

        for (ExecutionRecord r : recorder.records()) {
            assertTrue(r.workerId() >= 0 && r.workerId() < WORKERS, "worker " + r.workerId());
        }
    }

    @Test
    void interruptedRunRestoresFlagAndClosesRecords() throws Exception {
        List<TaskDescriptor> tasks = PolicyFixtures.batchOf(TaskType.IO, 20, 0, 30);
        AdaptivePolicy adaptive = (AdaptivePolicy) deps.policy(PolicyType.ADAPTIVE);

        ExecutionSummary[] result = new ExecutionSummary[1];
        boolean[] flagAfterRun = new boolean[1];
        Thread runner = new Thread(() -> {
            result[0] = adaptive.run(tasks, PolicyFixtures.sleeping());
            flagAfterRun[0] = Thread.currentThread().isInterrupted();
        });
        runner.start();
        Thread.sleep(60);
        runner.interrupt();
        runner.join(10_000);

        assertFalse(runner.isAlive());
        assertTrue(flagAfterRun[0]);
        assertEquals(20, result[0].total());
        assertTrue(result[0].completed() + result[0].failed() <= 20);
        assertEquals(0, recorder.openCount());
        assertEquals(0, adaptive.governor().occupancy().admitted());
    }

    @Test
    void selectorsRoundTrip() {
        for (PolicyType type : PolicyType.values()) {
            assertEquals(type, PolicyType.fromSelector(type.selector().toUpperCase()));
        }
        assertThrows(IllegalArgumentException.class, () -> PolicyType.fromSelector("fifo"));
        assertThrows(IllegalArgumentException.class, () -> PolicyType.fromSelector(null));
    }
}
