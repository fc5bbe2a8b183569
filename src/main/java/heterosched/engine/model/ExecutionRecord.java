package heterosched.engine.model;

/**
 * One start/end entry in the execution ledger.
 * Offsets are seconds since the recorder's run start; {@code endOffset} is
 * {@code null} while the task is still running.
 */
public record ExecutionRecord(
        int taskId,
        int workerId,
        TaskType type,
        double startOffset,
        Double endOffset,
        boolean failed) {

    public static ExecutionRecord open(int taskId, int workerId, TaskType type, double startOffset) {
        return new ExecutionRecord(taskId, workerId, type, startOffset, null, false);
    }

    public boolean isOpen() {
        return endOffset == null;
    }

    public boolean matches(int taskId, int workerId) {
        return this.taskId == taskId && this.workerId == workerId;
    }

    /** Closed copy of this record. */
    public ExecutionRecord close(double endOffset, boolean failed) {
        if (!isOpen()) {
            throw new IllegalStateException("Record for task " + taskId + " on worker " + workerId
                    + " is already closed");
        }
        return new ExecutionRecord(taskId, workerId, type, startOffset, Math.max(startOffset, endOffset), failed);
    }

    /** Seconds between start and end, 0 for open records. */
    public double duration() {
        return isOpen() ? 0.0 : endOffset - startOffset;
    }
}
