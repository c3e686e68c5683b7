package schedulerapp.persistence.repository;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import schedulerapp.persistence.entity.CrontabSchedule;
import schedulerapp.persistence.entity.PeriodicTask;

/**
 * Spring Data repository for {@link PeriodicTask} rows.
 */
@Repository
public interface PeriodicTaskRepository extends JpaRepository<PeriodicTask, Long> {

    /**
     * Live reference check used for orphan detection; there is no stored counter.
     *
     * @param crontab schedule to look for
     * @return true if at least one task references it
     */
    boolean existsByCrontab(CrontabSchedule crontab);

    List<PeriodicTask> findAllByOrderByIdAsc();
}
