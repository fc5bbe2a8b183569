package heterosched.engine.model;

/**
 * Diagnostics for one adaptive controller tick.
 */
public record ControllerTick(
        double timeOffset,
        double throughput,
        int admitted,
        int ceiling,
        Decision decision) {

    public enum Decision {
        RAISE,
        LOWER,
        HOLD
    }
}
