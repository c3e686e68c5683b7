package schedulerapp.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import schedulerapp.domain.Schedule;
import schedulerapp.domain.Validation;

/**
 * Provides the {@link Clock} used to stamp {@code PeriodicTask.dateChanged}.
 *
 * <p>Stamps are stored as instants, so {@code app.timezone} only sets the zone the clock
 * reports. Crontab schedules carry their own timezone and ignore it.
 *
 * <pre>
 * app:
 *   timezone: UTC
 * </pre>
 */
@Configuration
public class ClockConfig {

    static final String TIMEZONE_PROPERTY = "app.timezone";

    /**
     * @param timezone IANA zone id; blank means the JVM default zone
     * @return system clock in that zone
     * @throws IllegalArgumentException if the zone id is unknown
     */
    @Bean
    public Clock clock(@Value("${app.timezone:}") final String timezone) {
        if (!StringUtils.hasText(timezone)) {
            return Clock.systemDefaultZone();
        }
        final String zoneId = Validation.validateTimezone(timezone.strip(), TIMEZONE_PROPERTY, Schedule.FIELD_MAX_LENGTH);
        return Clock.system(ZoneId.of(zoneId));
    }
}
