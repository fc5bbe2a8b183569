package heterosched.engine.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-size pool of worker threads, each carrying a stable worker id.
 * Ids start at {@code firstWorkerId} so that pools used side by side in one
 * run report distinct workers.
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    /** Worker id reported for threads that do not belong to a pool. */
    public static final int NOT_A_WORKER = -1;

    private static final ThreadLocal<Integer> WORKER_ID = new ThreadLocal<>();

    private final String name;
    private final int size;
    private final Duration shutdownTimeout;
    private final ExecutorService executor;

    private volatile boolean shutDown;

    public WorkerPool(String name, int size, int firstWorkerId, Duration shutdownTimeout) {
        if (size < 1) {
            throw new IllegalArgumentException("pool size must be positive");
        }
        this.name = name;
        this.size = size;
        this.shutdownTimeout = shutdownTimeout;

        AtomicInteger next = new AtomicInteger(firstWorkerId);
        this.executor = Executors.newFixedThreadPool(size, r -> {
            int id = next.getAndIncrement();
            Thread t = new Thread(() -> {
                WORKER_ID.set(id);
                r.run();
            }, name + "-worker-" + id);
            t.setDaemon(true);
            return t;
        });
        log.debug("Pool {} started with {} workers", name, size);
    }

    /** Id of the pool worker running the calling thread, or {@link #NOT_A_WORKER}. */
    public static int currentWorkerId() {
        Integer id = WORKER_ID.get();
        return id != null ? id : NOT_A_WORKER;
    }

    public Future<?> submit(Runnable task) {
        return executor.submit(task);
    }

    public int size() {
        return size;
    }

    public String name() {
        return name;
    }

    /**
     * Stop accepting work and wait for running and queued tasks.
     * Falls back to interrupting the workers after the shutdown timeout or when
     * the caller is interrupted; queued tasks are dropped in that case.
     *
     * @return number of queued tasks that never ran
     */
    public int shutdown() {
        if (shutDown) {
            return 0;
        }
        shutDown = true;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                int dropped = executor.shutdownNow().size();
                log.warn("Pool {} forcefully stopped, {} queued tasks dropped", name, dropped);
                return dropped;
            }
        } catch (InterruptedException e) {
            int dropped = executor.shutdownNow().size();
            Thread.currentThread().interrupt();
            log.warn("Pool {} interrupted during shutdown, {} queued tasks dropped", name, dropped);
            return dropped;
        }
        log.debug("Pool {} stopped gracefully", name);
        return 0;
    }

    @Override
    public void close() {
        shutdown();
    }
}
