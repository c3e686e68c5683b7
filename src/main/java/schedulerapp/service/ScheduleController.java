package schedulerapp.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import schedulerapp.domain.Schedule;
import schedulerapp.domain.ScheduledTask;
import schedulerapp.exception.PeriodicTaskNotFoundException;
import schedulerapp.persistence.entity.CrontabSchedule;
import schedulerapp.persistence.entity.PeriodicTask;
import schedulerapp.persistence.store.ScheduleStore;

/**
 * Creates, updates, toggles and deletes periodic tasks while keeping crontab schedules
 * deduplicated and free of orphans.
 *
 * <p>Every operation runs inside the caller's unit of work and never opens a transaction
 * itself; {@link PeriodicTaskService} is the transaction-per-call entry point.
 *
 * <h2>Schedule sharing</h2>
 * <ul>
 *   <li>Tasks with identical schedule fields share one {@link CrontabSchedule} row.</li>
 *   <li>Shared rows are never edited. Rescheduling a task rebinds it to another row.</li>
 *   <li>A row is deleted together with the last task referencing it, determined by a
 *       live query at delete time.</li>
 *   <li>{@link #updateTask} does not delete the row it rebinds away from.</li>
 * </ul>
 */
@Service
@Transactional(propagation = Propagation.MANDATORY)
public class ScheduleController {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleController.class);

    private final ScheduleStore store;
    private final KwargsCodec kwargsCodec;
    private final Clock clock;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton stores collaborator beans")
    public ScheduleController(
            final ScheduleStore store,
            final KwargsCodec kwargsCodec,
            final Clock clock) {
        this.store = store;
        this.kwargsCodec = kwargsCodec;
        this.clock = clock;
    }

    /**
     * Returns the stored schedule whose six fields equal {@code schedule}, or a new
     * unsaved one carrying those fields. Nothing is written; the new row is persisted
     * when a task referencing it is registered.
     *
     * <p>Matching is exact: {@code "1-5"} and {@code "1,2,3,4,5"} are different schedules.
     *
     * @param schedule scheduling intent (required)
     * @return stored or new schedule
     */
    public CrontabSchedule resolveOrCreateSchedule(final Schedule schedule) {
        if (schedule == null) {
            throw new IllegalArgumentException("schedule must not be null");
        }
        return store.findCrontab(schedule)
                .map(existing -> {
                    LOG.debug("Reusing crontab schedule {} [{}]", existing.getId(), existing);
                    return existing;
                })
                .orElseGet(() -> new CrontabSchedule(schedule));
    }

    /**
     * Registers a new enabled task on the schedule matching the request.
     * Task names are not checked for uniqueness.
     *
     * @param scheduledTask name, job reference and schedule (required)
     * @param kwargs        argument bundle passed to the job, may be null
     * @return the registered task; its id is assigned by the store
     */
    public PeriodicTask scheduleTask(final ScheduledTask scheduledTask, final Map<String, ?> kwargs) {
        if (scheduledTask == null) {
            throw new IllegalArgumentException("scheduledTask must not be null");
        }
        final CrontabSchedule crontab = resolveOrCreateSchedule(scheduledTask.schedule());
        final PeriodicTask task = new PeriodicTask(
                scheduledTask.name(),
                scheduledTask.task(),
                kwargsCodec.encode(kwargs),
                crontab,
                clock.instant());
        final PeriodicTask registered = store.addTask(task);
        LOG.debug("Scheduled task '{}' ({}) on [{}]", registered.getName(), registered.getTask(), crontab);
        return registered;
    }

    /**
     * Enables or disables a task. The schedule is not touched.
     *
     * @param enabled new flag value
     * @param taskId  task to change
     * @return the updated task
     * @throws PeriodicTaskNotFoundException if no task has that id
     */
    public PeriodicTask updateTaskEnabledStatus(final boolean enabled, final long taskId) {
        final PeriodicTask task = requireTask(taskId);
        task.setEnabled(enabled, clock.instant());
        LOG.debug("Task {} enabled={}", taskId, enabled);
        return store.addTask(task);
    }

    /**
     * Renames, re-targets and reschedules a task. kwargs are kept. The previously bound
     * schedule stays in the store even if nothing references it any more.
     *
     * @param scheduledTask new name, job reference and schedule (required)
     * @param taskId        task to change
     * @return the updated task
     * @throws PeriodicTaskNotFoundException if no task has that id
     */
    public PeriodicTask updateTask(final ScheduledTask scheduledTask, final long taskId) {
        if (scheduledTask == null) {
            throw new IllegalArgumentException("scheduledTask must not be null");
        }
        final PeriodicTask task = requireTask(taskId);
        final CrontabSchedule crontab = resolveOrCreateSchedule(scheduledTask.schedule());
        task.reschedule(scheduledTask.name(), scheduledTask.task(), crontab, clock.instant());
        LOG.debug("Updated task {} to '{}' ({}) on [{}]", taskId, task.getName(), task.getTask(), crontab);
        return store.addTask(task);
    }

    /**
     * @param crontab schedule to check
     * @return true if at least one task currently references it
     */
    public boolean crontabIsUsed(final CrontabSchedule crontab) {
        return store.isCrontabReferenced(crontab);
    }

    /**
     * Deletes a task, then deletes its schedule if no other task uses it.
     *
     * <p>The task removal is flushed before the reference check so the check does not
     * count the task being deleted.
     *
     * @param taskId task to delete
     * @return the deleted task, for reporting
     * @throws PeriodicTaskNotFoundException if no task has that id
     */
    public PeriodicTask deleteTask(final long taskId) {
        final PeriodicTask task = requireTask(taskId);
        final CrontabSchedule crontab = task.getCrontab();
        store.deleteTask(task);
        store.flush();
        LOG.info("Deleted periodic task {} '{}'", taskId, task.getName());
        if (!crontabIsUsed(crontab)) {
            store.deleteCrontab(crontab);
            LOG.info("Deleted orphaned crontab schedule {} [{}]", crontab.getId(), crontab);
        }
        return task;
    }

    private PeriodicTask requireTask(final long taskId) {
        return store.findTask(taskId)
                .orElseThrow(() -> new PeriodicTaskNotFoundException(taskId));
    }
}
