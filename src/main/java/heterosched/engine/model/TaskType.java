package heterosched.engine.model;

/**
 * Resource profile of a task.
 */
public enum TaskType {
    /** CPU-intensive work */
    COMPUTE("Compute", 'C'),
    /** Memory-intensive work */
    MEMORY("Memory", 'M'),
    /** I/O-bound work, simulated with sleeps */
    IO("IO", 'I'),
    /** Compute, memory and I/O in one task */
    MIXED("Mixed", 'X');

    private final String label;
    private final char symbol;

    TaskType(String label, char symbol) {
        this.label = label;
        this.symbol = symbol;
    }

    public String label() {
        return label;
    }

    /** Single character used on timelines. */
    public char symbol() {
        return symbol;
    }

    /**
     * Parse a type from its name or label, case-insensitive.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static TaskType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("task type is required");
        }
        String v = value.trim();
        for (TaskType type : values()) {
            if (type.name().equalsIgnoreCase(v) || type.label.equalsIgnoreCase(v)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + value);
    }
}
