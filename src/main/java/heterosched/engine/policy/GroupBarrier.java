package heterosched.engine.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Full barrier over a submitted group: returns only after every task of the
 * group has finished, not merely been submitted.
 */
public final class GroupBarrier {

    private static final Logger log = LoggerFactory.getLogger(GroupBarrier.class);

    private GroupBarrier() {
    }

    /**
     * Wait for every future of the group.
     * A task ending abnormally is logged; the wait continues with the rest.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public static void waitForGroup(Collection<? extends Future<?>> group) throws InterruptedException {
        for (Future<?> future : group) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.error("Task in group ended abnormally", e.getCause());
            } catch (CancellationException e) {
                log.warn("Task in group was cancelled");
            }
        }
    }
}
