package schedulerapp.persistence.store;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import schedulerapp.domain.Schedule;
import schedulerapp.persistence.entity.CrontabSchedule;
import schedulerapp.persistence.entity.PeriodicTask;
import schedulerapp.persistence.repository.CrontabScheduleRepository;
import schedulerapp.persistence.repository.PeriodicTaskRepository;

/**
 * JPA-backed {@link ScheduleStore}.
 *
 * <p>All calls join the caller's transaction; the persistence context of that
 * transaction is the unit of work.
 */
@Component
public class JpaScheduleStore implements ScheduleStore {

    private static final Logger LOG = LoggerFactory.getLogger(JpaScheduleStore.class);

    private final CrontabScheduleRepository crontabRepository;
    private final PeriodicTaskRepository taskRepository;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton stores repository references; "
                    + "these are framework-managed beans with controlled lifecycle")
    public JpaScheduleStore(
            final CrontabScheduleRepository crontabRepository,
            final PeriodicTaskRepository taskRepository) {
        this.crontabRepository = crontabRepository;
        this.taskRepository = taskRepository;
    }

    @Override
    public Optional<PeriodicTask> findTask(final long taskId) {
        return taskRepository.findById(taskId);
    }

    @Override
    public List<PeriodicTask> findAllTasks() {
        return taskRepository.findAllByOrderByIdAsc();
    }

    @Override
    public Optional<CrontabSchedule> findCrontab(final Schedule schedule) {
        return crontabRepository.findByFields(
                schedule.minute(),
                schedule.hour(),
                schedule.dayOfWeek(),
                schedule.dayOfMonth(),
                schedule.monthOfYear(),
                schedule.timezone());
    }

    @Override
    public PeriodicTask addTask(final PeriodicTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        final CrontabSchedule crontab = task.getCrontab();
        if (crontab.isNew()) {
            crontabRepository.save(crontab);
            LOG.debug("Registered new crontab schedule [{}]", crontab);
        }
        return taskRepository.save(task);
    }

    @Override
    public void deleteTask(final PeriodicTask task) {
        taskRepository.delete(task);
    }

    @Override
    public void deleteCrontab(final CrontabSchedule crontab) {
        crontabRepository.delete(crontab);
    }

    @Override
    public boolean isCrontabReferenced(final CrontabSchedule crontab) {
        if (crontab == null || crontab.isNew()) {
            // a row that was never stored cannot be referenced by a stored task
            return false;
        }
        return taskRepository.existsByCrontab(crontab);
    }

    @Override
    public List<CrontabSchedule> findUnreferencedCrontabs() {
        return crontabRepository.findUnreferenced();
    }

    @Override
    public void flush() {
        taskRepository.flush();
    }
}
