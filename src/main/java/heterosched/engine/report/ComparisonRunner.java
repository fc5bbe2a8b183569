package heterosched.engine.report;

import heterosched.engine.config.SchedulerConfig;
import heterosched.engine.executor.WorkExecutor;
import heterosched.engine.model.ExecutionSummary;
import heterosched.engine.model.TaskDescriptor;
import heterosched.engine.policy.AdaptivePolicy;
import heterosched.engine.policy.PolicyType;
import heterosched.engine.policy.SchedulingPolicy;
import heterosched.engine.recorder.ExecutionRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs policies against a batch, resetting the recorder before each run.
 */
public class ComparisonRunner {

    private static final Logger log = LoggerFactory.getLogger(ComparisonRunner.class);

    private final SchedulerConfig config;
    private final ExecutionRecorder recorder;
    private final Map<PolicyType, SchedulingPolicy> policies;

    public ComparisonRunner(SchedulerConfig config, ExecutionRecorder recorder,
            Map<PolicyType, SchedulingPolicy> policies) {
        this.config = config;
        this.recorder = recorder;
        this.policies = policies;
    }

    /**
     * Run a single policy.
     */
    public PolicyRunReport run(PolicyType type, List<TaskDescriptor> tasks, WorkExecutor executor) {
        SchedulingPolicy policy = policies.get(type);
        if (policy == null) {
            throw new IllegalArgumentException("No policy registered for " + type);
        }

        recorder.reset();
        ExecutionSummary summary = policy.run(tasks, executor);

        Integer finalCeiling = policy instanceof AdaptivePolicy adaptive
                ? adaptive.governor().ceiling()
                : null;

        return PolicyRunReport.from(
                summary,
                recorder.snapshotByType(),
                recorder.snapshotByWorker(),
                recorder.throughputOverTime(config.throughputBuckets()),
                finalCeiling);
    }

    /**
     * Run every registered policy once on the same batch.
     */
    public ComparisonReport compareAll(List<TaskDescriptor> tasks, WorkExecutor executor) {
        List<PolicyRunReport> runs = new ArrayList<>();
        for (PolicyType type : PolicyType.values()) {
            if (!policies.containsKey(type)) {
                continue;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Comparison interrupted before {}", type.selector());
                break;
            }
            runs.add(run(type, tasks, executor));
        }
        ComparisonReport report = ComparisonReport.of(config.workerCount(), tasks.size(), runs);
        log.info("Compared {} policies, fastest: {}", runs.size(), report.fastest());
        return report;
    }

    /**
     * Wrap a single run in a report.
     */
    public ComparisonReport single(PolicyType type, List<TaskDescriptor> tasks, WorkExecutor executor) {
        return ComparisonReport.of(config.workerCount(), tasks.size(), List.of(run(type, tasks, executor)));
    }
}
