package heterosched.engine.model;

import java.util.Objects;

/**
 * Immutable description of one schedulable unit of work.
 * Shared read-only between policies and workers once generated.
 */
public final class TaskDescriptor {
    private final int id;
    private final TaskType type;
    private final int costHint;
    private final String name;

    private TaskDescriptor(Builder builder) {
        if (builder.id < 0) {
            throw new IllegalArgumentException("id must not be negative");
        }
        this.id = builder.id;
        this.type = Objects.requireNonNull(builder.type, "type is required");
        this.costHint = Math.max(0, builder.costHint);
        this.name = builder.name != null && !builder.name.isBlank()
                ? builder.name
                : "Task_" + builder.id;
    }

    public int id() {
        return id;
    }

    public TaskType type() {
        return type;
    }

    /** Relative amount of work; executors interpret it per type. */
    public int costHint() {
        return costHint;
    }

    public String name() {
        return name;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .costHint(costHint)
                .name(name);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shorthand for tests and executors that do not care about names. */
    public static TaskDescriptor of(int id, TaskType type, int costHint) {
        return builder().id(id).type(type).costHint(costHint).build();
    }

    public static final class Builder {
        private int id;
        private TaskType type;
        private int costHint;
        private String name;

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder type(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder costHint(int costHint) {
            this.costHint = costHint;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public TaskDescriptor build() {
            return new TaskDescriptor(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskDescriptor that))
            return false;
        return id == that.id && costHint == that.costHint && type == that.type && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, costHint, name);
    }

    @Override
    public String toString() {
        return "TaskDescriptor{id=" + id + ", type=" + type + ", cost=" + costHint + ", name='" + name + "'}";
    }
}
