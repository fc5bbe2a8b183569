package heterosched.engine.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import heterosched.engine.model.ExecutionSummary;
import heterosched.engine.model.TaskType;
import heterosched.engine.model.ThroughputBucket;
import heterosched.engine.model.TypeStats;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Report of one policy run: summary counts plus the recorder's view of it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyRunReport(
        @JsonProperty("policy") String policy,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("total") int total,
        @JsonProperty("elapsedMs") long elapsedMs,
        @JsonProperty("tasksPerSecond") double tasksPerSecond,
        @JsonProperty("byType") Map<String, TypeBreakdown> byType,
        @JsonProperty("tasksPerWorker") Map<Integer, Integer> tasksPerWorker,
        @JsonProperty("throughputOverTime") List<ThroughputBucket> throughputOverTime,
        @JsonProperty("finalCeiling") Integer finalCeiling) {

    /**
     * @param finalCeiling governor ceiling at the end of the run, or null for
     *                     policies that do not use the shared governor
     */
    public static PolicyRunReport from(ExecutionSummary summary,
            Map<TaskType, TypeStats> byType,
            Map<Integer, Map<TaskType, TypeStats>> byWorker,
            List<ThroughputBucket> throughput,
            Integer finalCeiling) {
        Map<String, TypeBreakdown> types = new LinkedHashMap<>();
        byType.forEach((type, stats) -> types.put(type.label(), TypeBreakdown.from(stats)));

        Map<Integer, Integer> perWorker = new LinkedHashMap<>();
        byWorker.forEach((worker, stats) -> perWorker.put(worker,
                stats.values().stream().mapToInt(TypeStats::count).sum()));

        return new PolicyRunReport(
                summary.policy(),
                summary.completed(),
                summary.failed(),
                summary.total(),
                summary.wallClock().toMillis(),
                summary.throughput(),
                types,
                perWorker,
                throughput,
                finalCeiling);
    }
}
