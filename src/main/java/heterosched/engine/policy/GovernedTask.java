package heterosched.engine.policy;

import heterosched.engine.governor.ConcurrencyGovernor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A submitted task holding one governor admission.
 * The admission is released exactly once: after the task ran, or through
 * {@link #abandon()} if the pool dropped it before it started.
 */
final class GovernedTask implements Runnable {

    private final ConcurrencyGovernor governor;
    private final Runnable body;
    private final AtomicBoolean settled = new AtomicBoolean();

    GovernedTask(ConcurrencyGovernor governor, Runnable body) {
        this.governor = governor;
        this.body = body;
    }

    @Override
    public void run() {
        if (!settled.compareAndSet(false, true)) {
            return;
        }
        try {
            body.run();
        } finally {
            governor.release();
        }
    }

    /** Release the admission if the task never started. */
    void abandon() {
        if (settled.compareAndSet(false, true)) {
            governor.release();
        }
    }
}
