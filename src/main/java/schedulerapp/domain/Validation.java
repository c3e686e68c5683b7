package schedulerapp.domain;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Shared input guards for scheduling requests.
 *
 * <p>Every guard throws {@link IllegalArgumentException} with a message that names the
 * offending field, so callers can surface the message unchanged.
 *
 * <p>Cron fields are never trimmed: schedule identity is an exact match on the text the
 * caller supplied, so {@code " 5"} and {@code "5"} stay distinct values.
 */
public final class Validation {

    private Validation() {
        // utility class
    }

    /**
     * Ensures the value is neither null nor blank.
     *
     * @param value the value to check
     * @param label field name used in the error message
     * @throws IllegalArgumentException if the value is null or blank
     */
    public static void validateNotBlank(final String value, final String label) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(label + " must not be null or blank");
        }
    }

    /**
     * Ensures the value is present and at most {@code maxLength} characters long.
     *
     * @param value     the value to check
     * @param label     field name used in the error message
     * @param maxLength inclusive upper bound
     * @return the value, untouched
     * @throws IllegalArgumentException if the value is blank or too long
     */
    public static String validateLength(final String value, final String label, final int maxLength) {
        validateNotBlank(value, label);
        if (value.length() > maxLength) {
            throw new IllegalArgumentException(
                    label + " length must be between 1 and " + maxLength);
        }
        return value;
    }

    /**
     * Ensures the value is a zone id {@link ZoneId#of(String)} accepts.
     *
     * @param value     the IANA zone id, e.g. {@code "UTC"} or {@code "Europe/Vilnius"}
     * @param label     field name used in the error message
     * @param maxLength inclusive upper bound on the id length
     * @return the value, untouched
     * @throws IllegalArgumentException if the id is blank, too long or unknown
     */
    public static String validateTimezone(final String value, final String label, final int maxLength) {
        validateLength(value, label, maxLength);
        try {
            ZoneId.of(value);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException(label + " is not a valid timezone: " + value, e);
        }
        return value;
    }
}
