package heterosched.engine.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Results of running one or more policies on the same batch.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComparisonReport(
        @JsonProperty("workers") int workers,
        @JsonProperty("tasks") int tasks,
        @JsonProperty("runs") List<PolicyRunReport> runs,
        @JsonProperty("fastest") String fastest) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static ComparisonReport of(int workers, int tasks, List<PolicyRunReport> runs) {
        String fastest = runs.stream()
                .min(Comparator.comparingLong(PolicyRunReport::elapsedMs))
                .map(PolicyRunReport::policy)
                .orElse(null);
        return new ComparisonReport(workers, tasks, List.copyOf(runs), fastest);
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize comparison report", e);
        }
    }

    /** Plain text table, one line per policy. */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%d tasks on %d workers%n", tasks, workers));
        sb.append(String.format(Locale.ROOT, "%-12s | %9s | %6s | %5s | %10s | %9s%n",
                "Policy", "Completed", "Failed", "Total", "Elapsed ms", "Tasks/s"));
        sb.append("-------------+-----------+--------+-------+------------+----------").append(System.lineSeparator());
        for (PolicyRunReport run : runs) {
            sb.append(String.format(Locale.ROOT, "%-12s | %9d | %6d | %5d | %10d | %9.1f%n",
                    run.policy(), run.completed(), run.failed(), run.total(), run.elapsedMs(),
                    run.tasksPerSecond()));
        }
        if (fastest != null && runs.size() > 1) {
            sb.append("Fastest: ").append(fastest).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
