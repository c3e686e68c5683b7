package schedulerapp.persistence.entity;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import schedulerapp.domain.ScheduledTask;

/**
 * Stored periodic task: a named job reference, its serialized kwargs, an enabled flag
 * and exactly one {@link CrontabSchedule}.
 *
 * <p>Names are not unique. {@code dateChanged} is stamped on every create, update and
 * toggle so an external beat process can tell which definitions need reloading.
 */
@Entity
@Table(name = "periodic_tasks")
public class PeriodicTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = ScheduledTask.NAME_MAX_LENGTH)
    private String name;

    @Column(nullable = false, length = ScheduledTask.NAME_MAX_LENGTH)
    private String task;

    @Column(nullable = false)
    private String kwargs;

    @Column(nullable = false)
    private boolean enabled = true;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "crontab_id", nullable = false)
    private CrontabSchedule crontab;

    @Column(name = "date_changed", nullable = false)
    private Instant dateChanged;

    /**
     * Default constructor for JPA.
     */
    protected PeriodicTask() {
    }

    /**
     * Creates a new, enabled task bound to {@code crontab}.
     *
     * @param name        task name
     * @param task        job type reference
     * @param kwargs      serialized argument bundle (JSON object text)
     * @param crontab     resolved schedule, persisted or not
     * @param dateChanged creation instant
     */
    public PeriodicTask(
            final String name,
            final String task,
            final String kwargs,
            final CrontabSchedule crontab,
            final Instant dateChanged) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.task = Objects.requireNonNull(task, "task must not be null");
        this.kwargs = Objects.requireNonNull(kwargs, "kwargs must not be null");
        this.crontab = Objects.requireNonNull(crontab, "crontab must not be null");
        this.dateChanged = Objects.requireNonNull(dateChanged, "dateChanged must not be null");
    }

    /**
     * Replaces name, job reference and schedule in one step. kwargs are left as they are.
     *
     * @param name        new task name
     * @param task        new job type reference
     * @param crontab     schedule to rebind to
     * @param dateChanged instant of the change
     */
    public void reschedule(
            final String name,
            final String task,
            final CrontabSchedule crontab,
            final Instant dateChanged) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.task = Objects.requireNonNull(task, "task must not be null");
        this.crontab = Objects.requireNonNull(crontab, "crontab must not be null");
        this.dateChanged = Objects.requireNonNull(dateChanged, "dateChanged must not be null");
    }

    /**
     * @param enabled     new flag value
     * @param dateChanged instant of the change
     */
    public void setEnabled(final boolean enabled, final Instant dateChanged) {
        this.enabled = enabled;
        this.dateChanged = Objects.requireNonNull(dateChanged, "dateChanged must not be null");
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getTask() {
        return task;
    }

    public String getKwargs() {
        return kwargs;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "JPA entity relationship requires returning the shared CrontabSchedule"
    )
    public CrontabSchedule getCrontab() {
        return crontab;
    }

    public Instant getDateChanged() {
        return dateChanged;
    }

    @Override
    public String toString() {
        return "PeriodicTask{id=" + id + ", name='" + name + "', task='" + task
                + "', enabled=" + enabled + ", crontab=" + crontab + '}';
    }
}
