package heterosched.engine.model;

/**
 * Completions per second within one time bucket ending at {@code bucketEndOffset}.
 */
public record ThroughputBucket(double bucketEndOffset, double tasksPerSecond) {
}
