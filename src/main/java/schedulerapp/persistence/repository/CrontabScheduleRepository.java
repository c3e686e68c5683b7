package schedulerapp.persistence.repository;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import schedulerapp.persistence.entity.CrontabSchedule;

/**
 * Spring Data repository for {@link CrontabSchedule} rows.
 *
 * <ul>
 *   <li>{@link #findByFields} - exact-match lookup used to deduplicate schedules</li>
 *   <li>{@link #findUnreferenced} - schedules no periodic task points at</li>
 * </ul>
 */
@Repository
public interface CrontabScheduleRepository extends JpaRepository<CrontabSchedule, Long> {

    /**
     * Finds the schedule whose six fields equal the arguments exactly.
     * The unique constraint on those columns guarantees at most one match.
     *
     * @return the matching schedule, if one is stored
     */
    @Query("SELECT c FROM CrontabSchedule c "
            + "WHERE c.minute = :minute AND c.hour = :hour "
            + "AND c.dayOfWeek = :dayOfWeek AND c.dayOfMonth = :dayOfMonth "
            + "AND c.monthOfYear = :monthOfYear AND c.timezone = :timezone")
    Optional<CrontabSchedule> findByFields(
            @Param("minute") String minute,
            @Param("hour") String hour,
            @Param("dayOfWeek") String dayOfWeek,
            @Param("dayOfMonth") String dayOfMonth,
            @Param("monthOfYear") String monthOfYear,
            @Param("timezone") String timezone);

    /**
     * @return schedules referenced by no periodic task, ordered by id
     */
    @Query("SELECT c FROM CrontabSchedule c "
            + "WHERE NOT EXISTS (SELECT p FROM PeriodicTask p WHERE p.crontab = c) "
            + "ORDER BY c.id")
    List<CrontabSchedule> findUnreferenced();
}
