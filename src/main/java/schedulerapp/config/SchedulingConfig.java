package schedulerapp.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on {@code @Scheduled} processing, which only the orphan schedule sweep uses.
 *
 * <p>Loaded when {@code scheduler.orphan-sweep.enabled=true}. Otherwise no scheduler thread is
 * started and unreferenced schedules are removed only when their last task is deleted.
 *
 * @see schedulerapp.service.OrphanScheduleSweeper
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "scheduler.orphan-sweep", name = "enabled", havingValue = "true")
public class SchedulingConfig {
}
