package schedulerapp.domain;

/**
 * Scheduling intent supplied by a caller: five cron fields plus a timezone.
 *
 * <p>Transient value, never persisted directly. The controller resolves it to a stored
 * {@code CrontabSchedule} with exactly the same six fields.
 *
 * <p>Constraints (checked on construction):
 * <ul>
 *   <li>each cron field: required, length 1-64, kept exactly as supplied</li>
 *   <li>timezone: required, length 1-64, a valid IANA zone id</li>
 * </ul>
 *
 * @param minute      minute field, e.g. {@code "0"} or {@code "*&#47;15"}
 * @param hour        hour field
 * @param dayOfWeek   day-of-week field
 * @param dayOfMonth  day-of-month field
 * @param monthOfYear month-of-year field
 * @param timezone    IANA zone id the fields are evaluated in
 */
public record Schedule(
        String minute,
        String hour,
        String dayOfWeek,
        String dayOfMonth,
        String monthOfYear,
        String timezone
) {

    /** Maximum length of each cron field and of the timezone id. */
    public static final int FIELD_MAX_LENGTH = 64;

    /** Wildcard matching every value of a cron field. */
    public static final String ANY = "*";

    public Schedule {
        Validation.validateLength(minute, "minute", FIELD_MAX_LENGTH);
        Validation.validateLength(hour, "hour", FIELD_MAX_LENGTH);
        Validation.validateLength(dayOfWeek, "dayOfWeek", FIELD_MAX_LENGTH);
        Validation.validateLength(dayOfMonth, "dayOfMonth", FIELD_MAX_LENGTH);
        Validation.validateLength(monthOfYear, "monthOfYear", FIELD_MAX_LENGTH);
        Validation.validateTimezone(timezone, "timezone", FIELD_MAX_LENGTH);
    }

    /**
     * Shorthand for a schedule that fires every day at {@code hour:minute}.
     *
     * @param minute   minute field
     * @param hour     hour field
     * @param timezone IANA zone id
     * @return schedule with wildcard day, month and weekday fields
     */
    public static Schedule daily(final String minute, final String hour, final String timezone) {
        return new Schedule(minute, hour, ANY, ANY, ANY, timezone);
    }
}
