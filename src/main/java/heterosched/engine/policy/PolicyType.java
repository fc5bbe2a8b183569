package heterosched.engine.policy;

/**
 * Available scheduling policies and their command line selectors.
 */
public enum PolicyType {
    NAIVE("naive"),
    GROUPED("grouped"),
    PRIORITY("priority"),
    PARTITIONED("partitioned"),
    ADAPTIVE("adaptive"),
    CAPPED("capped"),
    BATCHED("batched");

    private final String selector;

    PolicyType(String selector) {
        this.selector = selector;
    }

    public String selector() {
        return selector;
    }

    /**
     * @throws IllegalArgumentException for unknown selectors
     */
    public static PolicyType fromSelector(String value) {
        if (value != null) {
            for (PolicyType type : values()) {
                if (type.selector.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown policy: " + value);
    }
}
