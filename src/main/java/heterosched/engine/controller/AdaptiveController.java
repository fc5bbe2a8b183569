package heterosched.engine.controller;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.governor.ConcurrencyGovernor;
import heterosched.engine.model.ControllerTick;
import heterosched.engine.model.ControllerTick.Decision;
import heterosched.engine.model.Occupancy;
import heterosched.engine.model.ThroughputSample;
import heterosched.engine.recorder.ExecutionRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Feedback loop tuning a governor's ceiling while a run is in progress.
 *
 * Every interval it compares completions since the previous tick with the
 * governor's occupancy:
 * - near saturation (admitted at or above the raise threshold) with
 * non-decreasing throughput: raise the ceiling by one worker-pool width
 * - mostly idle (admitted at or below the lower threshold): lower it by one
 * width, never below the worker count
 *
 * Stopping is cooperative: {@link #markDone()} sets a flag that the next tick
 * observes, after which the controller is {@link State#STOPPED} for good.
 */
public class AdaptiveController implements Runnable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveController.class);

    public enum State {
        MONITORING,
        STOPPED
    }

    private final ExecutionRecorder recorder;
    private final ConcurrencyGovernor governor;
    private final LongSupplier nanoClock;
    private final Duration interval;
    private final Duration shutdownTimeout;
    private final int floor;
    private final int increment;
    private final int maxCeiling;
    private final double raiseThreshold;
    private final double lowerThreshold;

    private final ScheduledExecutorService executor;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final List<ControllerTick> history = new CopyOnWriteArrayList<>();

    private final long startNanos;
    private volatile boolean done = false;
    private volatile boolean started = false;
    private volatile State state = State.MONITORING;

    // Guarded by this
    private ThroughputSample previousSample;
    private double previousThroughput;

    public AdaptiveController(ExecutionRecorder recorder, ConcurrencyGovernor governor, SchedulerConfig config) {
        this(recorder, governor, config, System::nanoTime);
    }

    /**
     * @param nanoClock monotonic clock used to measure tick spacing
     */
    public AdaptiveController(ExecutionRecorder recorder, ConcurrencyGovernor governor, SchedulerConfig config,
            LongSupplier nanoClock) {
        this.recorder = recorder;
        this.governor = governor;
        this.nanoClock = nanoClock;
        this.interval = config.controllerInterval();
        this.shutdownTimeout = config.shutdownTimeout();
        this.floor = config.workerCount();
        this.increment = config.workerCount();
        this.maxCeiling = Math.max(config.maxCeiling(), floor);
        this.raiseThreshold = config.raiseThreshold();
        this.lowerThreshold = config.lowerThreshold();

        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "adaptive-controller");
            t.setDaemon(true);
            return t;
        });
        this.startNanos = nanoClock.getAsLong();
        this.previousSample = sample();
    }

    /**
     * Start ticking at the configured interval.
     */
    public void start() {
        if (started) {
            log.warn("Adaptive controller already started");
            return;
        }
        if (state == State.STOPPED) {
            log.warn("Adaptive controller already stopped");
            return;
        }
        started = true;

        long intervalMs = interval.toMillis();
        executor.scheduleAtFixedRate(this, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Adaptive controller started: interval {}ms, floor {}, increment {}, max ceiling {}",
                intervalMs, floor, increment, maxCeiling);
    }

    @Override
    public void run() {
        if (done) {
            stopMonitoring();
            return;
        }
        try {
            tick();
        } catch (Exception e) {
            log.error("Adaptive controller tick failed", e);
        }
    }

    /**
     * Measure throughput and occupancy and adjust the ceiling once.
     */
    public synchronized ControllerTick tick() {
        ThroughputSample current = sample();
        Occupancy occupancy = governor.occupancy();
        double throughput = current.rateSince(previousSample);

        int ceiling = occupancy.ceiling();
        int admitted = occupancy.admitted();
        int newCeiling = ceiling;
        Decision decision = Decision.HOLD;

        if (admitted >= raiseThreshold * ceiling && throughput >= previousThroughput && ceiling < maxCeiling) {
            newCeiling = Math.min(maxCeiling, ceiling + increment);
            decision = Decision.RAISE;
        } else if (admitted <= lowerThreshold * ceiling && ceiling > floor) {
            newCeiling = Math.max(floor, ceiling - increment);
            decision = Decision.LOWER;
        }

        if (decision != Decision.HOLD) {
            governor.setCeiling(newCeiling);
            log.info("Ceiling {} -> {} (admitted {}, {} tasks/s)",
                    ceiling, newCeiling, admitted, String.format("%.1f", throughput));
        }

        ControllerTick result = new ControllerTick(current.timeOffset(), throughput, admitted, newCeiling, decision);
        history.add(result);
        log.debug("Tick at {}s: completed {}, throughput {}, admitted {}, ceiling {}",
                String.format("%.2f", current.timeOffset()), current.completedCount(),
                String.format("%.1f", throughput), admitted, newCeiling);

        previousSample = current;
        previousThroughput = throughput;
        return result;
    }

    /**
     * Signal that the owning run has submitted and finished all of its tasks.
     * The controller thread observes the flag on an extra check queued right
     * away rather than waiting for the next interval.
     */
    public void markDone() {
        done = true;
        if (!started) {
            stopMonitoring();
            return;
        }
        try {
            executor.execute(this);
        } catch (RejectedExecutionException e) {
            log.debug("Adaptive controller already shut down");
        }
    }

    /**
     * Wait until the controller has observed the done flag.
     *
     * @return true if stopped within the timeout
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Mark done and wait for the controller to stop on its own; force it only if
     * it does not stop within two intervals plus the shutdown timeout.
     */
    @Override
    public void close() {
        markDone();
        try {
            if (!awaitStopped(interval.multipliedBy(2).plus(shutdownTimeout))) {
                log.warn("Adaptive controller did not stop in time, forcing shutdown");
                executor.shutdownNow();
                state = State.STOPPED;
                stopped.countDown();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            state = State.STOPPED;
            stopped.countDown();
            Thread.currentThread().interrupt();
        }
    }

    public State state() {
        return state;
    }

    public boolean isDone() {
        return done;
    }

    /** Ticks recorded so far, oldest first. */
    public List<ControllerTick> history() {
        return List.copyOf(history);
    }

    private synchronized void stopMonitoring() {
        if (state == State.STOPPED) {
            return;
        }
        state = State.STOPPED;
        executor.shutdown();
        stopped.countDown();
        log.info("Adaptive controller stopped after {} ticks, ceiling {}", history.size(), governor.ceiling());
    }

    private ThroughputSample sample() {
        double offset = (nanoClock.getAsLong() - startNanos) / 1_000_000_000.0;
        return new ThroughputSample(offset, recorder.completedCount());
    }
}
