package heterosched.engine.config;

import heterosched.engine.generator.TaskGenerator;
import heterosched.engine.governor.ConcurrencyGovernor;
import heterosched.engine.policy.AdaptivePolicy;
import heterosched.engine.policy.BatchedPolicy;
import heterosched.engine.policy.GroupedPolicy;
import heterosched.engine.policy.NaivePolicy;
import heterosched.engine.policy.PolicyType;
import heterosched.engine.policy.PriorityTieredPolicy;
import heterosched.engine.policy.ResourcePartitionedPolicy;
import heterosched.engine.policy.SchedulingPolicy;
import heterosched.engine.policy.TypeCappedPolicy;
import heterosched.engine.recorder.ExecutionRecorder;
import heterosched.engine.report.ComparisonRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Manual dependency injection container.
 * Creates one recorder and one governor and hands them to every policy.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(SchedulerConfig.fromEnv());
 * List&lt;TaskDescriptor&gt; tasks = deps.taskGenerator().generate(50, 10, 100);
 * ExecutionSummary summary = deps.policy(PolicyType.ADAPTIVE).run(tasks, executor);
 * </pre>
 */
public final class Dependencies {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SchedulerConfig config;
    private final ExecutionRecorder recorder;
    private final ConcurrencyGovernor governor;
    private final TaskGenerator taskGenerator;
    private final Map<PolicyType, SchedulingPolicy> policies;
    private final ComparisonRunner comparisonRunner;

    private Dependencies(SchedulerConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Shared state
        this.recorder = new ExecutionRecorder();
        this.governor = new ConcurrencyGovernor("adaptive", config.initialCeiling());

        this.taskGenerator = new TaskGenerator(config);

        // Policies
        Map<PolicyType, SchedulingPolicy> map = new EnumMap<>(PolicyType.class);
        map.put(PolicyType.NAIVE, new NaivePolicy(config, recorder));
        map.put(PolicyType.GROUPED, new GroupedPolicy(config, recorder));
        map.put(PolicyType.PRIORITY, new PriorityTieredPolicy(config, recorder));
        map.put(PolicyType.PARTITIONED, new ResourcePartitionedPolicy(config, recorder));
        map.put(PolicyType.ADAPTIVE, new AdaptivePolicy(config, recorder, governor));
        map.put(PolicyType.CAPPED, new TypeCappedPolicy(config, recorder));
        map.put(PolicyType.BATCHED, new BatchedPolicy(config, recorder));
        this.policies = Collections.unmodifiableMap(map);

        this.comparisonRunner = new ComparisonRunner(config, recorder, policies);

        log.info("Dependencies initialized with {} policies", policies.size());
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(SchedulerConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(SchedulerConfig.fromEnv());
    }

    // Getters
    public SchedulerConfig config() {
        return config;
    }

    public ExecutionRecorder recorder() {
        return recorder;
    }

    public ConcurrencyGovernor governor() {
        return governor;
    }

    public TaskGenerator taskGenerator() {
        return taskGenerator;
    }

    public SchedulingPolicy policy(PolicyType type) {
        return policies.get(type);
    }

    public Map<PolicyType, SchedulingPolicy> policies() {
        return policies;
    }

    public ComparisonRunner comparisonRunner() {
        return comparisonRunner;
    }
}
