package heterosched.engine.recorder;

import heterosched.engine.model.ExecutionRecord;
import heterosched.engine.model.TaskType;
import heterosched.engine.model.ThroughputBucket;
import heterosched.engine.model.TypeStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionRecorderTest {

    private static final long SECOND = 1_000_000_000L;

    private AtomicLong clock;
    private ExecutionRecorder recorder;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong(0);
        recorder = new ExecutionRecorder(clock::get);
    }

    @Test
    void startEndPairsAreCounted() {
        for (int i = 0; i < 10; i++) {
            recorder.recordStart(i, i % 3, i % 2 == 0 ? TaskType.COMPUTE : TaskType.IO);
        }
        clock.addAndGet(SECOND);
        for (int i = 0; i < 10; i++) {
            recorder.recordEnd(i, i % 3);
        }

        Map<TaskType, TypeStats> byType = recorder.snapshotByType();
        assertEquals(5, byType.get(TaskType.COMPUTE).count());
        assertEquals(5, byType.get(TaskType.IO).count());
        assertEquals(5.0, byType.get(TaskType.COMPUTE).totalDuration(), 1e-9);
        assertEquals(10, recorder.completedCount());
        assertEquals(0, recorder.openCount());
    }

    @Test
    void openRecordsAreExcludedFromStats() {
        recorder.recordStart(1, 0, TaskType.MEMORY);
        recorder.recordStart(2, 0, TaskType.MEMORY);
        clock.addAndGet(SECOND);
        recorder.recordEnd(1, 0);

        assertEquals(1, recorder.snapshotByType().get(TaskType.MEMORY).count());
        assertEquals(1, recorder.openCount());
    }

    @Test
    @DisplayName("An end without a start changes nothing")
    void unmatchedEndIsNoOp() {
        recorder.recordStart(1, 0, TaskType.IO);
        recorder.recordEnd(1, 5);
        recorder.recordEnd(99, 0);

        assertEquals(0, recorder.completedCount());
        assertEquals(1, recorder.openCount());
        assertTrue(recorder.snapshotByType().isEmpty());
    }

    @Test
    void duplicateStartIsIgnored() {
        recorder.recordStart(1, 0, TaskType.IO);
        recorder.recordStart(1, 0, TaskType.IO);

        assertEquals(1, recorder.records().size());
    }

    @Test
    void sameTaskCanRunAgainAfterClosing() {
        recorder.recordStart(1, 0, TaskType.IO);
        recorder.recordEnd(1, 0);
        recorder.recordStart(1, 0, TaskType.IO);
        recorder.recordEnd(1, 0);

        assertEquals(2, recorder.snapshotByType().get(TaskType.IO).count());
    }

    @Test
    void failedFlagIsKept() {
        recorder.recordStart(1, 0, TaskType.IO);
        recorder.recordStart(2, 0, TaskType.IO);
        recorder.recordEnd(1, 0, true);
        recorder.recordEnd(2, 0, false);

        assertEquals(1, recorder.snapshotByType().get(TaskType.IO).failedCount());
        List<ExecutionRecord> records = recorder.records();
        assertTrue(records.get(0).failed());
        assertFalse(records.get(1).failed());
    }

    @Test
    void byWorkerBreakdown() {
        recorder.recordStart(1, 0, TaskType.COMPUTE);
        recorder.recordStart(2, 1, TaskType.COMPUTE);
        recorder.recordStart(3, 1, TaskType.IO);
        recorder.recordEnd(1, 0);
        recorder.recordEnd(2, 1);
        recorder.recordEnd(3, 1);

        Map<Integer, Map<TaskType, TypeStats>> byWorker = recorder.snapshotByWorker();
        assertEquals(List.of(0, 1), new ArrayList<>(byWorker.keySet()));
        assertEquals(1, byWorker.get(0).get(TaskType.COMPUTE).count());
        assertEquals(1, byWorker.get(1).get(TaskType.COMPUTE).count());
        assertEquals(1, byWorker.get(1).get(TaskType.IO).count());
    }

    @Test
    void averageDurationByType() {
        recorder.recordStart(1, 0, TaskType.MEMORY);
        recorder.recordStart(2, 1, TaskType.MEMORY);
        clock.addAndGet(SECOND);
        recorder.recordEnd(1, 0);
        clock.addAndGet(2 * SECOND);
        recorder.recordEnd(2, 1);

        assertEquals(2.0, recorder.averageDurationByType().get(TaskType.MEMORY), 1e-9);
    }

    @Test
    void throughputBuckets() {
        // Completions at 1s, 2s, 2s and 4s over four one-second buckets
        long[] ends = { 1, 2, 2, 4 };
        for (int i = 0; i < ends.length; i++) {
            recorder.recordStart(i, 0, TaskType.IO);
        }
        for (int i = 0; i < ends.length; i++) {
            clock.set(ends[i] * SECOND);
            recorder.recordEnd(i, 0);
        }

        List<ThroughputBucket> buckets = recorder.throughputOverTime(4);
        assertEquals(4, buckets.size());
        assertEquals(1.0, buckets.get(0).tasksPerSecond(), 1e-9);
        assertEquals(2.0, buckets.get(1).tasksPerSecond(), 1e-9);
        assertEquals(0.0, buckets.get(2).tasksPerSecond(), 1e-9);
        assertEquals(1.0, buckets.get(3).tasksPerSecond(), 1e-9);
        assertEquals(4.0, buckets.get(3).bucketEndOffset(), 1e-9);
    }

    @Test
    void throughputWithoutCompletionsIsEmpty() {
        assertTrue(recorder.throughputOverTime(5).isEmpty());
        recorder.recordStart(1, 0, TaskType.IO);
        assertTrue(recorder.throughputOverTime(5).isEmpty());
    }

    @Test
    void nonPositiveBucketCountMeansOneBucket() {
        recorder.recordStart(1, 0, TaskType.IO);
        clock.set(2 * SECOND);
        recorder.recordEnd(1, 0);

        List<ThroughputBucket> buckets = recorder.throughputOverTime(0);
        assertEquals(1, buckets.size());
        assertEquals(0.5, buckets.get(0).tasksPerSecond(), 1e-9);
    }

    @Test
    void resetClearsRecordsAndClock() {
        recorder.recordStart(1, 0, TaskType.IO);
        recorder.recordEnd(1, 0);
        clock.set(10 * SECOND);

        recorder.reset();

        assertTrue(recorder.records().isEmpty());
        assertEquals(0, recorder.completedCount());
        assertEquals(0.0, recorder.elapsedSeconds(), 1e-9);
    }

    @Test
    @DisplayName("Concurrent starts and ends lose no records")
    void concurrentRecording() throws Exception {
        ExecutionRecorder real = new ExecutionRecorder();
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++) {
                        int taskId = worker * perThread + i;
                        real.recordStart(taskId, worker, TaskType.values()[i % 4]);
                        real.recordEnd(taskId, worker);
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        int total = real.snapshotByType().values().stream().mapToInt(TypeStats::count).sum();
        assertEquals(threads * perThread, total);
        assertEquals(threads * perThread, real.completedCount());
        assertEquals(threads, real.snapshotByWorker().size());
    }
}
