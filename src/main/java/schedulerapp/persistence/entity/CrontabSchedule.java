package schedulerapp.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.util.Objects;
import schedulerapp.domain.Schedule;

/**
 * Stored crontab schedule shared by every periodic task that runs on it.
 *
 * <p>Identity is structural: two schedules are equal when minute, hour, day of week,
 * day of month, month of year and timezone are all equal. The id plays no part in
 * {@link #equals(Object)}, and the store enforces the same rule with a unique constraint
 * over the six columns.
 *
 * <p>Rows are immutable once created. There are no setters for the cron fields; a task
 * that needs a different schedule is rebound to another row instead, since editing a
 * shared row would silently reschedule every other task that references it.
 *
 * @see PeriodicTask
 */
@Entity
@Table(name = "crontab_schedules", uniqueConstraints = @UniqueConstraint(
        name = "uk_crontab_schedules_fields",
        columnNames = {"minute", "hour", "day_of_week", "day_of_month", "month_of_year", "timezone"}))
public class CrontabSchedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = Schedule.FIELD_MAX_LENGTH)
    private String minute;

    @Column(nullable = false, updatable = false, length = Schedule.FIELD_MAX_LENGTH)
    private String hour;

    @Column(name = "day_of_week", nullable = false, updatable = false, length = Schedule.FIELD_MAX_LENGTH)
    private String dayOfWeek;

    @Column(name = "day_of_month", nullable = false, updatable = false, length = Schedule.FIELD_MAX_LENGTH)
    private String dayOfMonth;

    @Column(name = "month_of_year", nullable = false, updatable = false, length = Schedule.FIELD_MAX_LENGTH)
    private String monthOfYear;

    @Column(nullable = false, updatable = false, length = Schedule.FIELD_MAX_LENGTH)
    private String timezone;

    /**
     * Default constructor for JPA.
     */
    protected CrontabSchedule() {
    }

    /**
     * Creates a new, not yet persisted schedule carrying the fields of {@code schedule}.
     *
     * @param schedule validated scheduling intent
     */
    public CrontabSchedule(final Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        this.minute = schedule.minute();
        this.hour = schedule.hour();
        this.dayOfWeek = schedule.dayOfWeek();
        this.dayOfMonth = schedule.dayOfMonth();
        this.monthOfYear = schedule.monthOfYear();
        this.timezone = schedule.timezone();
    }

    /**
     * Checks whether this row has exactly the fields of {@code schedule}.
     *
     * @param schedule scheduling intent to compare against
     * @return true if all six fields are equal
     */
    public boolean matches(final Schedule schedule) {
        return schedule != null
                && minute.equals(schedule.minute())
                && hour.equals(schedule.hour())
                && dayOfWeek.equals(schedule.dayOfWeek())
                && dayOfMonth.equals(schedule.dayOfMonth())
                && monthOfYear.equals(schedule.monthOfYear())
                && timezone.equals(schedule.timezone());
    }

    /**
     * @return the six fields as a transient {@link Schedule}
     */
    public Schedule toSchedule() {
        return new Schedule(minute, hour, dayOfWeek, dayOfMonth, monthOfYear, timezone);
    }

    /**
     * @return true until the unit of work has assigned an id
     */
    public boolean isNew() {
        return id == null;
    }

    public Long getId() {
        return id;
    }

    public String getMinute() {
        return minute;
    }

    public String getHour() {
        return hour;
    }

    public String getDayOfWeek() {
        return dayOfWeek;
    }

    public String getDayOfMonth() {
        return dayOfMonth;
    }

    public String getMonthOfYear() {
        return monthOfYear;
    }

    public String getTimezone() {
        return timezone;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CrontabSchedule other)) {
            return false;
        }
        return Objects.equals(minute, other.getMinute())
                && Objects.equals(hour, other.getHour())
                && Objects.equals(dayOfWeek, other.getDayOfWeek())
                && Objects.equals(dayOfMonth, other.getDayOfMonth())
                && Objects.equals(monthOfYear, other.getMonthOfYear())
                && Objects.equals(timezone, other.getTimezone());
    }

    @Override
    public int hashCode() {
        return Objects.hash(minute, hour, dayOfWeek, dayOfMonth, monthOfYear, timezone);
    }

    @Override
    public String toString() {
        return minute + " " + hour + " " + dayOfMonth + " " + monthOfYear + " " + dayOfWeek
                + " (" + timezone + ")";
    }
}
