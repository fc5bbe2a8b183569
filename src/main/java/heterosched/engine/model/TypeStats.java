package heterosched.engine.model;

/**
 * Aggregate over closed execution records of one task type.
 */
public record TypeStats(int count, double totalDuration, int failedCount) {

    public static final TypeStats EMPTY = new TypeStats(0, 0.0, 0);

    public TypeStats add(ExecutionRecord record) {
        return new TypeStats(count + 1, totalDuration + record.duration(),
                failedCount + (record.failed() ? 1 : 0));
    }

    public double averageDuration() {
        return count > 0 ? totalDuration / count : 0.0;
    }
}
