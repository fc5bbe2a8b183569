package heterosched.engine.recorder;

import heterosched.engine.model.ExecutionRecord;
import heterosched.engine.model.TaskType;
import heterosched.engine.model.ThroughputBucket;
import heterosched.engine.model.TypeStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Thread-safe ledger of task start/end events for one scheduling run.
 *
 * All mutation happens under an internal lock that is held only for the
 * bookkeeping itself, never while a task executes. Statistics are computed
 * from a copy of the ledger taken under the same lock and cover closed
 * records only.
 *
 * {@link #reset()} must be called before each run; records from a previous
 * run otherwise leak into the next run's statistics.
 */
public class ExecutionRecorder {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRecorder.class);

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<ExecutionRecord> records = new ArrayList<>();
    private final LongSupplier nanoClock;

    private long runStartNanos;
    private int completed;

    public ExecutionRecorder() {
        this(System::nanoTime);
    }

    /**
     * @param nanoClock monotonic clock in nanoseconds
     */
    public ExecutionRecorder(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
        this.runStartNanos = nanoClock.getAsLong();
    }

    /**
     * Clear all records and restart the run clock.
     */
    public void reset() {
        lock.lock();
        try {
            records.clear();
            completed = 0;
            runStartNanos = nanoClock.getAsLong();
        } finally {
            lock.unlock();
        }
        log.debug("Recorder reset");
    }

    /**
     * Append an open record for a task starting on a worker.
     * A second start for a pair that still has an open record is ignored with a warning.
     */
    public void recordStart(int taskId, int workerId, TaskType type) {
        if (type == null) {
            log.warn("Ignoring start of task {} on worker {}: no task type", taskId, workerId);
            return;
        }
        lock.lock();
        try {
            double now = offsetNow();
            if (findOpen(taskId, workerId) >= 0) {
                log.warn("Task {} already has an open record on worker {}; start ignored", taskId, workerId);
                return;
            }
            records.add(ExecutionRecord.open(taskId, workerId, type, now));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Close the most recent open record of a task on a worker.
     */
    public void recordEnd(int taskId, int workerId) {
        recordEnd(taskId, workerId, false);
    }

    /**
     * Close the most recent open record of a task on a worker.
     * Without a matching open record this is a no-op that logs a warning.
     *
     * @param failed whether the task ended with an error
     */
    public void recordEnd(int taskId, int workerId, boolean failed) {
        boolean found;
        lock.lock();
        try {
            double now = offsetNow();
            int index = findOpen(taskId, workerId);
            found = index >= 0;
            if (found) {
                records.set(index, records.get(index).close(now, failed));
                completed++;
            }
        } finally {
            lock.unlock();
        }
        if (!found) {
            log.warn("Could not find matching start record for task {} on worker {}", taskId, workerId);
        }
    }

    /**
     * Count and total duration per type over closed records.
     */
    public Map<TaskType, TypeStats> snapshotByType() {
        Map<TaskType, TypeStats> stats = new EnumMap<>(TaskType.class);
        for (ExecutionRecord r : closedRecords()) {
            stats.merge(r.type(), TypeStats.EMPTY.add(r), (a, b) -> a.add(r));
        }
        return stats;
    }

    /**
     * Per-worker breakdown of {@link #snapshotByType()}, ordered by worker id.
     */
    public Map<Integer, Map<TaskType, TypeStats>> snapshotByWorker() {
        Map<Integer, Map<TaskType, TypeStats>> stats = new TreeMap<>();
        for (ExecutionRecord r : closedRecords()) {
            stats.computeIfAbsent(r.workerId(), k -> new EnumMap<>(TaskType.class))
                    .merge(r.type(), TypeStats.EMPTY.add(r), (a, b) -> a.add(r));
        }
        return stats;
    }

    /** Mean duration in seconds per type. */
    public Map<TaskType, Double> averageDurationByType() {
        Map<TaskType, Double> averages = new EnumMap<>(TaskType.class);
        snapshotByType().forEach((type, s) -> averages.put(type, s.averageDuration()));
        return averages;
    }

    /**
     * Completions per second over equal buckets spanning {@code [0, maxEndOffset]}.
     *
     * @param numBuckets number of buckets; values below 1 are treated as 1
     * @return one entry per bucket, or an empty list when nothing has completed
     */
    public List<ThroughputBucket> throughputOverTime(int numBuckets) {
        List<ExecutionRecord> closed = closedRecords();
        if (closed.isEmpty()) {
            return List.of();
        }
        int buckets = Math.max(1, numBuckets);

        double maxEnd = 0.0;
        for (ExecutionRecord r : closed) {
            maxEnd = Math.max(maxEnd, r.endOffset());
        }
        if (maxEnd <= 0.0) {
            return List.of();
        }

        double width = maxEnd / buckets;
        int[] counts = new int[buckets];
        for (ExecutionRecord r : closed) {
            int index = (int) Math.ceil(r.endOffset() / width) - 1;
            counts[Math.max(0, Math.min(index, buckets - 1))]++;
        }

        List<ThroughputBucket> result = new ArrayList<>(buckets);
        for (int i = 0; i < buckets; i++) {
            double end = (i == buckets - 1) ? maxEnd : (i + 1) * width;
            result.add(new ThroughputBucket(end, counts[i] / width));
        }
        return result;
    }

    /** Number of closed records since the last reset. */
    public int completedCount() {
        lock.lock();
        try {
            return completed;
        } finally {
            lock.unlock();
        }
    }

    /** Number of records still waiting for their end event. */
    public int openCount() {
        lock.lock();
        try {
            return records.size() - completed;
        } finally {
            lock.unlock();
        }
    }

    /** Immutable copy of the ledger in start order. */
    public List<ExecutionRecord> records() {
        lock.lock();
        try {
            return List.copyOf(records);
        } finally {
            lock.unlock();
        }
    }

    /** Seconds since the last reset. */
    public double elapsedSeconds() {
        lock.lock();
        try {
            return offsetNow();
        } finally {
            lock.unlock();
        }
    }

    private List<ExecutionRecord> closedRecords() {
        List<ExecutionRecord> copy = records();
        if (copy.isEmpty()) {
            return Collections.emptyList();
        }
        List<ExecutionRecord> closed = new ArrayList<>(copy.size());
        for (ExecutionRecord r : copy) {
            if (!r.isOpen()) {
                closed.add(r);
            }
        }
        return closed;
    }

    // Caller holds the lock
    private int findOpen(int taskId, int workerId) {
        for (int i = records.size() - 1; i >= 0; i--) {
            ExecutionRecord r = records.get(i);
            if (r.isOpen() && r.matches(taskId, workerId)) {
                return i;
            }
        }
        return -1;
    }

    // Caller holds the lock
    private double offsetNow() {
        return (nanoClock.getAsLong() - runStartNanos) / NANOS_PER_SECOND;
    }
}
