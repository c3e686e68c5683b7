package schedulerapp.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import schedulerapp.persistence.entity.CrontabSchedule;
import schedulerapp.persistence.store.ScheduleStore;

/**
 * Removes crontab schedules that no task references.
 *
 * <p>{@link ScheduleController#updateTask} leaves the schedule it rebinds away from in
 * place. This sweep collects those rows. It only runs on a timer when
 * {@code scheduler.orphan-sweep.enabled=true}; see {@link schedulerapp.config.SchedulingConfig}.
 */
@Component
public class OrphanScheduleSweeper {

    private static final Logger LOG = LoggerFactory.getLogger(OrphanScheduleSweeper.class);

    private final ScheduleStore store;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Spring-managed singleton stores collaborator beans")
    public OrphanScheduleSweeper(final ScheduleStore store) {
        this.store = store;
    }

    /**
     * Deletes every unreferenced schedule.
     *
     * @return number of schedules deleted
     */
    @Transactional
    public int sweep() {
        final List<CrontabSchedule> orphans = store.findUnreferencedCrontabs();
        for (final CrontabSchedule orphan : orphans) {
            store.deleteCrontab(orphan);
            LOG.debug("Sweeping orphaned crontab schedule {} [{}]", orphan.getId(), orphan);
        }
        return orphans.size();
    }

    /**
     * Timer entry point. Runs every hour at minute 0 unless
     * {@code scheduler.orphan-sweep.cron} says otherwise.
     */
    @Scheduled(cron = "${scheduler.orphan-sweep.cron:0 0 * * * *}")
    @Transactional
    public void scheduledSweep() {
        final int deleted = sweep();
        if (deleted > 0) {
            LOG.info("Orphan sweep deleted {} crontab schedules", deleted);
        }
    }
}
