package heterosched.engine.model;

/**
 * Completed task count observed at a moment of the run (seconds since start).
 */
public record ThroughputSample(double timeOffset, int completedCount) {

    /** Tasks per second between an earlier sample and this one. */
    public double rateSince(ThroughputSample previous) {
        double dt = timeOffset - previous.timeOffset;
        return dt > 0 ? (completedCount - previous.completedCount) / dt : 0.0;
    }
}
