package heterosched.engine.generator;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.model.TaskDescriptor;
import heterosched.engine.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Produces batches of task descriptors with a chosen mix of types.
 *
 * Counts per type are proportional to the weights; when the batch has at least
 * four tasks every type gets at least one, and rounding leftovers go to the
 * overflow type. The batch is shuffled so generation order does not correlate
 * with type.
 */
public class TaskGenerator {

    private static final Logger log = LoggerFactory.getLogger(TaskGenerator.class);

    private final SchedulerConfig config;
    private final Random random;

    public TaskGenerator(SchedulerConfig config) {
        this(config, config.seed() != null ? new Random(config.seed()) : new Random());
    }

    public TaskGenerator(SchedulerConfig config, Random random) {
        this.config = config;
        this.random = random;
    }

    /**
     * Generate with the configured type weights.
     */
    public List<TaskDescriptor> generate(int count, int minCost, int maxCost) {
        return generate(count, minCost, maxCost, config.typeWeights());
    }

    /**
     * Generate a shuffled batch.
     *
     * @param count   requested number of tasks; values below 1 yield an empty batch
     * @param minCost lower bound of the cost hint, clamped to the configured range
     * @param maxCost upper bound of the cost hint, clamped to {@code [minCost, ceiling]}
     * @param weights Compute, Memory, IO, Mixed weights; need not sum to 1
     * @throws GenerationException if the weights are negative, not finite, or all zero
     */
    public List<TaskDescriptor> generate(int count, int minCost, int maxCost, double... weights) {
        if (count <= 0) {
            log.warn("Requested {} tasks, generating an empty batch", count);
            return List.of();
        }
        if (count > config.maxTasks()) {
            log.warn("Requested {} tasks, clamping to {}", count, config.maxTasks());
            count = config.maxTasks();
        }

        int lo = clamp(minCost, config.costFloor(), config.costCeiling());
        int hi = clamp(maxCost, lo, config.costCeiling());

        Map<TaskType, Integer> counts = countsPerType(count, weights);

        List<TaskDescriptor> tasks = new ArrayList<>(count);
        for (TaskType type : TaskType.values()) {
            int n = counts.getOrDefault(type, 0);
            for (int i = 0; i < n; i++) {
                int cost = lo == hi ? lo : lo + random.nextInt(hi - lo + 1);
                tasks.add(TaskDescriptor.builder()
                        .id(tasks.size())
                        .type(type)
                        .costHint(cost)
                        .name(type.label() + "_" + i)
                        .build());
            }
        }

        Collections.shuffle(tasks, random);

        log.info("Generated {} tasks (cost {}..{}): {}", tasks.size(), lo, hi, counts);
        return List.copyOf(tasks);
    }

    /**
     * Split {@code count} across types.
     * Package-private so the rounding rules can be tested without randomness.
     */
    Map<TaskType, Integer> countsPerType(int count, double[] weights) {
        TaskType[] types = TaskType.values();
        if (weights == null || weights.length != types.length) {
            throw new GenerationException("Expected " + types.length + " type weights");
        }

        double sum = 0.0;
        for (double w : weights) {
            if (Double.isNaN(w) || Double.isInfinite(w) || w < 0) {
                throw new GenerationException("Type weights must be finite and non-negative");
            }
            sum += w;
        }
        if (sum <= 0.0) {
            throw new GenerationException("At least one type weight must be positive");
        }

        Map<TaskType, Integer> counts = new EnumMap<>(TaskType.class);
        int assigned = 0;
        for (int i = 0; i < types.length; i++) {
            int n = (int) Math.floor(count * (weights[i] / sum));
            if (count >= types.length) {
                n = Math.max(1, n);
            }
            counts.put(types[i], n);
            assigned += n;
        }

        // Raising empty types to one can overshoot; take back from the largest group
        while (assigned > count) {
            TaskType largest = largest(counts);
            counts.put(largest, counts.get(largest) - 1);
            assigned--;
        }

        TaskType overflow = config.overflowType();
        counts.put(overflow, counts.get(overflow) + (count - assigned));
        return counts;
    }

    /**
     * Fail if a run would start without any tasks.
     *
     * @throws GenerationException on an empty batch
     */
    public static List<TaskDescriptor> requireViable(List<TaskDescriptor> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            throw new GenerationException("Generation produced no tasks; check the task count");
        }
        return tasks;
    }

    private static TaskType largest(Map<TaskType, Integer> counts) {
        TaskType best = null;
        for (Map.Entry<TaskType, Integer> e : counts.entrySet()) {
            if (best == null || e.getValue() > counts.get(best)) {
                best = e.getKey();
            }
        }
        return best;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(value, max));
    }
}
