package heterosched.engine.config;

import heterosched.engine.model.TaskType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration holder for scheduler settings.
 * All settings have sensible defaults.
 */
public final class SchedulerConfig {

    // Worker settings
    private int workerCount = Math.max(1, Runtime.getRuntime().availableProcessors());
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    // Generation settings
    private int maxTasks = 1000;
    private int costFloor = 10;
    private int costCeiling = 1000;
    private double[] typeWeights = { 0.4, 0.3, 0.2, 0.1 };
    private TaskType overflowType = TaskType.MIXED;
    private Long seed = null; // null = fresh randomness per generator

    // Policy settings
    private List<TaskType> priorityOrder = List.of(TaskType.COMPUTE, TaskType.MEMORY, TaskType.MIXED, TaskType.IO);
    private Map<TaskType, Double> partitionShares = defaultPartitionShares();
    private Map<TaskType, Integer> typeCapDivisors = defaultTypeCapDivisors();
    private int batchFactor = 2;

    // Adaptive settings
    private int initialCeilingFactor = 2;
    private int maxCeilingFactor = 8;
    private Duration controllerInterval = Duration.ofMillis(500);
    private double raiseThreshold = 0.8;
    private double lowerThreshold = 0.4;

    // Reporting
    private int throughputBuckets = 5;

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        SchedulerConfig config = new SchedulerConfig();

        // Override from environment variables
        String workers = System.getenv("HETEROSCHED_WORKERS");
        if (workers != null && !workers.isBlank()) {
            config.withWorkerCount(Integer.parseInt(workers.trim()));
        }

        String seed = System.getenv("HETEROSCHED_SEED");
        if (seed != null && !seed.isBlank()) {
            config.seed = Long.parseLong(seed.trim());
        }

        String interval = System.getenv("HETEROSCHED_CONTROLLER_INTERVAL_MS");
        if (interval != null && !interval.isBlank()) {
            config.withControllerInterval(Duration.ofMillis(Long.parseLong(interval.trim())));
        }

        String order = System.getenv("HETEROSCHED_PRIORITY_ORDER");
        if (order != null && !order.isBlank()) {
            config.withPriorityOrder(parsePriorityOrder(order));
        }

        String shares = System.getenv("HETEROSCHED_PARTITION_SHARES");
        if (shares != null && !shares.isBlank()) {
            config.withPartitionShares(parsePartitionShares(shares));
        }

        return config;
    }

    /**
     * Parse a comma separated list of task types, highest priority first,
     * e.g. {@code "compute,memory,mixed,io"}. Types left out are appended in
     * declaration order.
     */
    public static List<TaskType> parsePriorityOrder(String value) {
        List<TaskType> order = new ArrayList<>();
        for (String part : value.split(",")) {
            if (part.isBlank())
                continue;
            TaskType type = TaskType.parse(part);
            if (!order.contains(type)) {
                order.add(type);
            }
        }
        return order;
    }

    /**
     * Parse {@code type=share} pairs, e.g. {@code "compute=0.5,memory=0.3,io=0.1"}.
     */
    public static Map<TaskType, Double> parsePartitionShares(String value) {
        Map<TaskType, Double> shares = new EnumMap<>(TaskType.class);
        for (String part : value.split(",")) {
            if (part.isBlank())
                continue;
            String[] kv = part.split("=", 2);
            if (kv.length != 2) {
                throw new IllegalArgumentException("Expected type=share but got: " + part);
            }
            shares.put(TaskType.parse(kv[0]), Double.parseDouble(kv[1].trim()));
        }
        return shares;
    }

    private static Map<TaskType, Double> defaultPartitionShares() {
        Map<TaskType, Double> shares = new EnumMap<>(TaskType.class);
        shares.put(TaskType.COMPUTE, 0.5);
        shares.put(TaskType.MEMORY, 0.3);
        shares.put(TaskType.IO, 0.1);
        // MIXED takes the remainder
        return Collections.unmodifiableMap(shares);
    }

    private static Map<TaskType, Integer> defaultTypeCapDivisors() {
        Map<TaskType, Integer> divisors = new EnumMap<>(TaskType.class);
        divisors.put(TaskType.COMPUTE, 2);
        divisors.put(TaskType.MEMORY, 3);
        divisors.put(TaskType.IO, 4);
        // MIXED is uncapped
        return Collections.unmodifiableMap(divisors);
    }

    // Getters
    public int workerCount() {
        return workerCount;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public int maxTasks() {
        return maxTasks;
    }

    public int costFloor() {
        return costFloor;
    }

    public int costCeiling() {
        return costCeiling;
    }

    /** Weights in {@link TaskType} declaration order. */
    public double[] typeWeights() {
        return typeWeights.clone();
    }

    public TaskType overflowType() {
        return overflowType;
    }

    public Long seed() {
        return seed;
    }

    public List<TaskType> priorityOrder() {
        return priorityOrder;
    }

    public Map<TaskType, Double> partitionShares() {
        return partitionShares;
    }

    public Map<TaskType, Integer> typeCapDivisors() {
        return typeCapDivisors;
    }

    public int batchFactor() {
        return batchFactor;
    }

    public int initialCeilingFactor() {
        return initialCeilingFactor;
    }

    public int maxCeilingFactor() {
        return maxCeilingFactor;
    }

    public Duration controllerInterval() {
        return controllerInterval;
    }

    public double raiseThreshold() {
        return raiseThreshold;
    }

    public double lowerThreshold() {
        return lowerThreshold;
    }

    public int throughputBuckets() {
        return throughputBuckets;
    }

    /** Ceiling the adaptive policy starts from. */
    public int initialCeiling() {
        return workerCount * initialCeilingFactor;
    }

    /** Upper bound the adaptive controller never raises past. */
    public int maxCeiling() {
        return workerCount * maxCeilingFactor;
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withWorkerCount(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workerCount must be positive");
        }
        this.workerCount = workers;
        return this;
    }

    public SchedulerConfig withShutdownTimeout(Duration timeout) {
        this.shutdownTimeout = timeout;
        return this;
    }

    public SchedulerConfig withMaxTasks(int maxTasks) {
        this.maxTasks = Math.max(1, maxTasks);
        return this;
    }

    public SchedulerConfig withCostBounds(int floor, int ceiling) {
        if (floor < 1 || ceiling < floor) {
            throw new IllegalArgumentException("cost bounds must satisfy 1 <= floor <= ceiling");
        }
        this.costFloor = floor;
        this.costCeiling = ceiling;
        return this;
    }

    public SchedulerConfig withTypeWeights(double compute, double memory, double io, double mixed) {
        this.typeWeights = new double[] { compute, memory, io, mixed };
        return this;
    }

    public SchedulerConfig withOverflowType(TaskType type) {
        this.overflowType = type;
        return this;
    }

    public SchedulerConfig withSeed(Long seed) {
        this.seed = seed;
        return this;
    }

    public SchedulerConfig withPriorityOrder(List<TaskType> order) {
        List<TaskType> full = new ArrayList<>(order);
        for (TaskType type : TaskType.values()) {
            if (!full.contains(type)) {
                full.add(type);
            }
        }
        this.priorityOrder = List.copyOf(full);
        return this;
    }

    public SchedulerConfig withPartitionShares(Map<TaskType, Double> shares) {
        for (Map.Entry<TaskType, Double> e : shares.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0 || e.getValue().isNaN()) {
                throw new IllegalArgumentException("Invalid share for " + e.getKey() + ": " + e.getValue());
            }
        }
        Map<TaskType, Double> copy = new EnumMap<>(TaskType.class);
        copy.putAll(shares);
        this.partitionShares = Collections.unmodifiableMap(copy);
        return this;
    }

    public SchedulerConfig withTypeCapDivisors(Map<TaskType, Integer> divisors) {
        Map<TaskType, Integer> copy = new EnumMap<>(TaskType.class);
        copy.putAll(divisors);
        this.typeCapDivisors = Collections.unmodifiableMap(copy);
        return this;
    }

    public SchedulerConfig withBatchFactor(int factor) {
        this.batchFactor = Math.max(1, factor);
        return this;
    }

    public SchedulerConfig withInitialCeilingFactor(int factor) {
        this.initialCeilingFactor = Math.max(1, factor);
        return this;
    }

    public SchedulerConfig withMaxCeilingFactor(int factor) {
        this.maxCeilingFactor = Math.max(1, factor);
        return this;
    }

    public SchedulerConfig withControllerInterval(Duration interval) {
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("controllerInterval must be positive");
        }
        this.controllerInterval = interval;
        return this;
    }

    public SchedulerConfig withThresholds(double raise, double lower) {
        if (lower < 0 || raise > 1 || lower >= raise) {
            throw new IllegalArgumentException("thresholds must satisfy 0 <= lower < raise <= 1");
        }
        this.raiseThreshold = raise;
        this.lowerThreshold = lower;
        return this;
    }

    public SchedulerConfig withThroughputBuckets(int buckets) {
        this.throughputBuckets = Math.max(1, buckets);
        return this;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "workers=" + workerCount +
                ", maxTasks=" + maxTasks +
                ", cost=[" + costFloor + ".." + costCeiling + "]" +
                ", priorityOrder=" + priorityOrder +
                ", partitionShares=" + partitionShares +
                ", controllerInterval=" + controllerInterval.toMillis() + "ms" +
                ", seedSet=" + (seed != null) +
                '}';
    }
}
