package schedulerapp.exception;

/**
 * Thrown when an operation addresses a periodic task id that has no row.
 */
public class PeriodicTaskNotFoundException extends ResourceNotFoundException {

    private static final long serialVersionUID = 1L;

    private final long taskId;

    /**
     * @param taskId the id that was looked up
     */
    public PeriodicTaskNotFoundException(final long taskId) {
        super("Periodic task", taskId);
        this.taskId = taskId;
    }

    public long getTaskId() {
        return taskId;
    }
}
