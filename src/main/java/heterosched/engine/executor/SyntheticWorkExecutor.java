package heterosched.engine.executor;

import heterosched.engine.model.TaskDescriptor;
import heterosched.engine.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stand-in workloads for each task type.
 *
 * <ul>
 * <li>COMPUTE: floating point loop, {@code cost} rounds of {@link #COMPUTE_ITERATIONS}</li>
 * <li>MEMORY: strided writes over a local buffer of {@code cost * 1000} ints, capped at 10 MiB</li>
 * <li>IO: sleeps {@code cost} milliseconds</li>
 * <li>MIXED: half compute, a quarter memory, a quarter sleep</li>
 * </ul>
 */
public class SyntheticWorkExecutor implements WorkExecutor {

    private static final Logger log = LoggerFactory.getLogger(SyntheticWorkExecutor.class);

    static final int COMPUTE_ITERATIONS = 10_000;
    private static final int MAX_BUFFER_INTS = 10 * 1024 * 1024 / Integer.BYTES;
    private static final int MEMORY_PASSES = 10;
    private static final int STRIDE = 16;

    private final Set<TaskType> failingTypes;

    // Keeps the JIT from discarding the compute loop
    private volatile double sink;

    public SyntheticWorkExecutor() {
        this(EnumSet.noneOf(TaskType.class));
    }

    /**
     * @param failingTypes types whose tasks fail after doing their work
     */
    public SyntheticWorkExecutor(Set<TaskType> failingTypes) {
        this.failingTypes = failingTypes.isEmpty()
                ? EnumSet.noneOf(TaskType.class)
                : EnumSet.copyOf(failingTypes);
    }

    @Override
    public void execute(TaskDescriptor task) throws WorkExecutionException {
        int cost = task.costHint();
        try {
            switch (task.type()) {
                case COMPUTE -> compute(cost);
                case MEMORY -> touchMemory(cost * 1000);
                case IO -> Thread.sleep(cost);
                case MIXED -> {
                    compute(cost / 2);
                    touchMemory((cost / 4) * 100);
                    Thread.sleep(cost / 4);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkExecutionException(task, "Interrupted while running " + task.name(), e);
        } catch (OutOfMemoryError e) {
            throw new WorkExecutionException(task, "Could not allocate buffer for " + task.name(), e);
        }

        if (failingTypes.contains(task.type())) {
            throw new WorkExecutionException(task, "Injected failure for " + task.type().label() + " task");
        }
        log.trace("Task {} done", task.id());
    }

    private void compute(int rounds) {
        double acc = 0.0;
        for (int r = 0; r < rounds; r++) {
            for (int i = 1; i <= COMPUTE_ITERATIONS; i++) {
                acc += Math.sqrt(i) * Math.sin(i);
            }
        }
        sink = acc;
    }

    private void touchMemory(int ints) {
        int size = Math.max(STRIDE, Math.min(ints, MAX_BUFFER_INTS));
        int[] data = new int[size];
        for (int pass = 0; pass < MEMORY_PASSES; pass++) {
            for (int i = 0; i < size; i += STRIDE) {
                data[i] += pass;
            }
        }
        sink = data[size - STRIDE];
    }
}
