package schedulerapp.domain;

import java.util.Objects;

/**
 * Request to create or update a periodic task.
 *
 * @param name     task name (required, length 1-200, not required to be unique)
 * @param task     reference to the executable job type, opaque to this service
 *                 (required, length 1-200)
 * @param schedule when the task should run (required)
 */
public record ScheduledTask(
        String name,
        String task,
        Schedule schedule
) {

    /** Maximum length of the task name and the job reference. */
    public static final int NAME_MAX_LENGTH = 200;

    public ScheduledTask {
        Validation.validateLength(name, "name", NAME_MAX_LENGTH);
        Validation.validateLength(task, "task", NAME_MAX_LENGTH);
        if (Objects.isNull(schedule)) {
            throw new IllegalArgumentException("schedule must not be null");
        }
    }
}
