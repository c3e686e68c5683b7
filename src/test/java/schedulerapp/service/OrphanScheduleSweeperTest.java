package schedulerapp.service;

import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import schedulerapp.domain.Schedule;
import schedulerapp.persistence.entity.CrontabSchedule;
import schedulerapp.persistence.entity.PeriodicTask;
import schedulerapp.support.InMemoryScheduleStore;

import static org.assertj.core.api.Assertions.assertThat;

class OrphanScheduleSweeperTest {

    private InMemoryScheduleStore store;
    private OrphanScheduleSweeper sweeper;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduleStore();
        sweeper = new OrphanScheduleSweeper(store);
    }

    @Test
    void sweep_deletesOnlyUnreferencedSchedules() {
        final CrontabSchedule orphan = store.seedCrontab(Schedule.daily("0", "4", "UTC"));
        final PeriodicTask task = store.addTask(new PeriodicTask("kept", "jobs.kept", "{}",
                new CrontabSchedule(Schedule.daily("0", "5", "UTC")), Instant.EPOCH));

        final int deleted = sweeper.sweep();

        assertThat(deleted).isEqualTo(1);
        assertThat(store.containsCrontab(orphan)).isFalse();
        assertThat(store.containsCrontab(task.getCrontab())).isTrue();
    }

    @Test
    void sweep_nothingToDoReturnsZero() {
        assertThat(sweeper.sweep()).isZero();
    }

    @Test
    void scheduledSweep_runsSweep() {
        store.seedCrontab(Schedule.daily("0", "4", "UTC"));

        sweeper.scheduledSweep();

        assertThat(store.crontabCount()).isZero();
    }
}
