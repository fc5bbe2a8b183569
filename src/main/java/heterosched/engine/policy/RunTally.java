package heterosched.engine.policy;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Completed/failed counters for one run, updated by workers.
 */
final class RunTally {

    private final AtomicInteger completed = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();

    void record(boolean taskFailed) {
        if (taskFailed) {
            failed.incrementAndGet();
        } else {
            completed.incrementAndGet();
        }
    }

    int completed() {
        return completed.get();
    }

    int failed() {
        return failed.get();
    }
}
