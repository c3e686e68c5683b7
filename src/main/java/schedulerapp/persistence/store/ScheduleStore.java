package schedulerapp.persistence.store;

import java.util.List;
import java.util.Optional;
import schedulerapp.domain.Schedule;
import schedulerapp.persistence.entity.CrontabSchedule;
import schedulerapp.persistence.entity.PeriodicTask;

/**
 * Unit of work over the schedule and task tables.
 *
 * <p>The controller depends on this interface rather than Spring Data directly so the
 * scheduling rules can be exercised against the JPA-backed store in production and a
 * lightweight in-memory double in unit tests.
 *
 * <p>Writes are registrations: an added or deleted row becomes visible to queries after
 * {@link #flush()} and durable when the caller's transaction commits. Implementations do
 * not open transactions of their own.
 */
public interface ScheduleStore {

    /**
     * @param taskId identifier to look up
     * @return the task if one exists
     */
    Optional<PeriodicTask> findTask(long taskId);

    /**
     * @return all tasks ordered by id
     */
    List<PeriodicTask> findAllTasks();

    /**
     * Exact-match lookup on all six schedule fields.
     *
     * @param schedule fields to match
     * @return the stored schedule with exactly those fields, if any
     */
    Optional<CrontabSchedule> findCrontab(Schedule schedule);

    /**
     * Registers a new or modified task for persistence. A schedule the task points at
     * that has not been persisted yet is registered along with it.
     *
     * @param task task to register
     * @return the registered instance
     */
    PeriodicTask addTask(PeriodicTask task);

    /**
     * Registers removal of a task. Its schedule is left untouched.
     *
     * @param task task to remove
     */
    void deleteTask(PeriodicTask task);

    /**
     * Registers removal of a schedule. Callers check it is unreferenced first.
     *
     * @param crontab schedule to remove
     */
    void deleteCrontab(CrontabSchedule crontab);

    /**
     * Live query: does any task currently reference {@code crontab}?
     *
     * @param crontab schedule to check
     * @return true if at least one task references it
     */
    boolean isCrontabReferenced(CrontabSchedule crontab);

    /**
     * @return schedules no task references, ordered by id
     */
    List<CrontabSchedule> findUnreferencedCrontabs();

    /**
     * Pushes pending registrations to the store so later queries in the same
     * transaction observe them.
     */
    void flush();
}
