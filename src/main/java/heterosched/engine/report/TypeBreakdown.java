package heterosched.engine.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import heterosched.engine.model.TypeStats;

/**
 * Per-type statistics of one run, durations in seconds.
 */
public record TypeBreakdown(
        @JsonProperty("count") int count,
        @JsonProperty("failed") int failed,
        @JsonProperty("totalSeconds") double totalSeconds,
        @JsonProperty("averageSeconds") double averageSeconds) {

    public static TypeBreakdown from(TypeStats stats) {
        return new TypeBreakdown(stats.count(), stats.failedCount(), stats.totalDuration(), stats.averageDuration());
    }
}
