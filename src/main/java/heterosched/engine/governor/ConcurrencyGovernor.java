package heterosched.engine.governor;

import heterosched.engine.model.Occupancy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded admission gate.
 *
 * Tracks how many tasks are admitted against a ceiling that may change at
 * runtime. {@code admitted <= ceiling} holds whenever an admission succeeds;
 * lowering the ceiling never evicts tasks that are already admitted, it only
 * holds back new admissions until enough of them are released.
 *
 * Every successful admission must be paired with exactly one {@link #release()};
 * {@link #acquire()} wraps the pair for try-with-resources.
 */
public class ConcurrencyGovernor {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyGovernor.class);

    private final String name;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition capacityAvailable = lock.newCondition();

    private int ceiling;
    private int admitted;
    private int peakAdmitted;

    public ConcurrencyGovernor(int ceiling) {
        this("governor", ceiling);
    }

    public ConcurrencyGovernor(String name, int ceiling) {
        this.name = name;
        this.ceiling = Math.max(1, ceiling);
    }

    /**
     * Admit one task, waiting while the governor is full.
     *
     * @throws InterruptedException if interrupted while waiting; nothing is admitted then
     */
    public void admit() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (admitted >= ceiling) {
                capacityAvailable.await();
            }
            admitOne();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Admit one task, waiting at most {@code timeout}.
     *
     * @return true if admitted
     */
    public boolean tryAdmit(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (admitted >= ceiling) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = capacityAvailable.awaitNanos(remaining);
            }
            admitOne();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean tryAdmit(long timeout, TimeUnit unit) throws InterruptedException {
        return tryAdmit(Duration.ofNanos(unit.toNanos(timeout)));
    }

    /**
     * Admit one task and return a handle that releases it on close.
     */
    public Admission acquire() throws InterruptedException {
        admit();
        return new Admission(this);
    }

    /**
     * Release one admitted task and wake one waiter.
     */
    public void release() {
        boolean unmatched = false;
        lock.lock();
        try {
            if (admitted == 0) {
                unmatched = true;
            } else {
                admitted--;
                capacityAvailable.signal();
            }
        } finally {
            lock.unlock();
        }
        if (unmatched) {
            log.warn("{}: release() without a matching admit()", name);
        }
    }

    /**
     * Replace the ceiling. Values below 1 are clamped to 1.
     * Takes effect for future admissions only.
     */
    public void setCeiling(int newCeiling) {
        int clamped = Math.max(1, newCeiling);
        int previous;
        lock.lock();
        try {
            previous = ceiling;
            ceiling = clamped;
            if (clamped > previous) {
                capacityAvailable.signalAll();
            }
        } finally {
            lock.unlock();
        }
        if (previous != clamped) {
            log.debug("{}: ceiling {} -> {}", name, previous, clamped);
        }
    }

    /** Consistent (admitted, ceiling) pair. */
    public Occupancy occupancy() {
        lock.lock();
        try {
            return new Occupancy(admitted, ceiling);
        } finally {
            lock.unlock();
        }
    }

    public int ceiling() {
        lock.lock();
        try {
            return ceiling;
        } finally {
            lock.unlock();
        }
    }

    /** Highest admitted count seen since construction or the last {@link #resetPeak()}. */
    public int peakAdmitted() {
        lock.lock();
        try {
            return peakAdmitted;
        } finally {
            lock.unlock();
        }
    }

    public void resetPeak() {
        lock.lock();
        try {
            peakAdmitted = admitted;
        } finally {
            lock.unlock();
        }
    }

    public String name() {
        return name;
    }

    // Caller holds the lock
    private void admitOne() {
        admitted++;
        if (admitted > peakAdmitted) {
            peakAdmitted = admitted;
        }
    }

    @Override
    public String toString() {
        Occupancy o = occupancy();
        return "ConcurrencyGovernor{name='" + name + "', admitted=" + o.admitted() + ", ceiling=" + o.ceiling() + '}';
    }

    /**
     * One admission; closing it releases the slot exactly once.
     */
    public static final class Admission implements AutoCloseable {
        private final ConcurrencyGovernor governor;
        private final AtomicBoolean released = new AtomicBoolean();

        private Admission(ConcurrencyGovernor governor) {
            this.governor = governor;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                governor.release();
            }
        }
    }
}
