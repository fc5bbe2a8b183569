package heterosched.engine.model;

import java.time.Duration;

/**
 * Outcome of one policy run.
 * {@code completed} counts successful tasks only; failed tasks are counted separately.
 */
public record ExecutionSummary(
        String policy,
        int completed,
        int failed,
        int total,
        Duration wallClock) {

    public static ExecutionSummary empty(String policy) {
        return new ExecutionSummary(policy, 0, 0, 0, Duration.ZERO);
    }

    /** Finished tasks (including failed ones) per second of wall clock. */
    public double throughput() {
        double seconds = wallClock.toNanos() / 1_000_000_000.0;
        return seconds > 0 ? (completed + failed) / seconds : 0.0;
    }

    public boolean allSucceeded() {
        return failed == 0 && completed == total;
    }
}
