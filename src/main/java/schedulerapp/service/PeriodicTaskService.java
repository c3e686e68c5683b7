package schedulerapp.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import schedulerapp.domain.ScheduledTask;
import schedulerapp.exception.PeriodicTaskNotFoundException;
import schedulerapp.persistence.entity.CrontabSchedule;
import schedulerapp.persistence.entity.PeriodicTask;
import schedulerapp.persistence.store.ScheduleStore;

/**
 * Entry point for callers that do not manage their own unit of work.
 *
 * <p>Each method runs one {@link ScheduleController} operation in its own transaction and
 * commits before returning, so the returned entities are detached snapshots.
 *
 * <p>Create and update flush inside the transaction. Two callers resolving the same new
 * schedule concurrently both try to insert it; the loser fails on the unique constraint
 * with a {@link DataIntegrityViolationException}. That transaction is rolled back and the
 * call is re-run in a fresh one, where the resolver finds the winner's row. The number of
 * re-runs is bounded by {@code scheduler.schedule-conflict-retries}. Every other failure
 * propagates unchanged.
 *
 * <p>Writes always run in a new transaction ({@code REQUIRES_NEW}). A caller's surrounding
 * transaction is suspended for the duration of the call, so a conflict rolls back only the
 * attempt and never marks the caller's transaction rollback-only. Reads join a surrounding
 * transaction when there is one.
 */
@Service
public class PeriodicTaskService {

    private static final Logger LOG = LoggerFactory.getLogger(PeriodicTaskService.class);

    private final ScheduleController controller;
    private final ScheduleStore store;
    private final KwargsCodec kwargsCodec;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final int scheduleConflictRetries;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton stores collaborator beans")
    public PeriodicTaskService(
            final ScheduleController controller,
            final ScheduleStore store,
            final KwargsCodec kwargsCodec,
            final PlatformTransactionManager transactionManager,
            @Value("${scheduler.schedule-conflict-retries:1}") final int scheduleConflictRetries) {
        if (scheduleConflictRetries < 0) {
            throw new IllegalArgumentException("scheduler.schedule-conflict-retries must not be negative");
        }
        this.controller = controller;
        this.store = store;
        this.kwargsCodec = kwargsCodec;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
        this.scheduleConflictRetries = scheduleConflictRetries;
    }

    /**
     * @see ScheduleController#scheduleTask(ScheduledTask, Map)
     */
    public PeriodicTask scheduleTask(final ScheduledTask scheduledTask, final Map<String, ?> kwargs) {
        return withConflictRetry("schedule task", () -> {
            final PeriodicTask task = controller.scheduleTask(scheduledTask, kwargs);
            store.flush();
            return task;
        });
    }

    /**
     * @see ScheduleController#updateTask(ScheduledTask, long)
     */
    public PeriodicTask updateTask(final ScheduledTask scheduledTask, final long taskId) {
        return withConflictRetry("update task " + taskId, () -> {
            final PeriodicTask task = controller.updateTask(scheduledTask, taskId);
            store.flush();
            return task;
        });
    }

    /**
     * @see ScheduleController#updateTaskEnabledStatus(boolean, long)
     */
    public PeriodicTask updateTaskEnabledStatus(final boolean enabled, final long taskId) {
        return transactionTemplate.execute(status -> controller.updateTaskEnabledStatus(enabled, taskId));
    }

    /**
     * @see ScheduleController#deleteTask(long)
     */
    public PeriodicTask deleteTask(final long taskId) {
        return transactionTemplate.execute(status -> controller.deleteTask(taskId));
    }

    /**
     * @see ScheduleController#crontabIsUsed(CrontabSchedule)
     */
    public boolean crontabIsUsed(final CrontabSchedule crontab) {
        return Boolean.TRUE.equals(readOnlyTemplate.execute(status -> controller.crontabIsUsed(crontab)));
    }

    /**
     * @param taskId task to load
     * @return the task
     * @throws PeriodicTaskNotFoundException if no task has that id
     */
    public PeriodicTask findTask(final long taskId) {
        return readOnlyTemplate.execute(status -> store.findTask(taskId)
                .orElseThrow(() -> new PeriodicTaskNotFoundException(taskId)));
    }

    /**
     * @return all tasks ordered by id
     */
    public List<PeriodicTask> listTasks() {
        return readOnlyTemplate.execute(status -> store.findAllTasks());
    }

    /**
     * @param task a loaded task
     * @return its argument bundle
     */
    public Map<String, Object> decodeKwargs(final PeriodicTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        return kwargsCodec.decode(task.getKwargs());
    }

    private <T> T withConflictRetry(final String operation, final Supplier<T> work) {
        int attempt = 0;
        while (true) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (DataIntegrityViolationException e) {
                if (attempt >= scheduleConflictRetries) {
                    throw e;
                }
                attempt++;
                LOG.warn("Conflict while trying to {} (attempt {} of {}), retrying: {}",
                        operation, attempt, scheduleConflictRetries, e.getMostSpecificCause().getMessage());
            }
        }
    }
}
