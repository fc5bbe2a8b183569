package heterosched.engine.model;

/**
 * Admitted task count paired with the ceiling it was read against.
 */
public record Occupancy(int admitted, int ceiling) {

    /** Fraction of the ceiling in use. */
    public double utilization() {
        return ceiling > 0 ? (double) admitted / ceiling : 0.0;
    }

    public boolean isFull() {
        return admitted >= ceiling;
    }
}
