package schedulerapp.domain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.DateTimeException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Validation}.
 */
class ValidationTest {

    @Test
    void validateNotBlank_acceptsText() {
        assertThatNoException().isThrownBy(() -> Validation.validateNotBlank("x", "field"));
    }

    @Test
    void validateNotBlank_rejectsNull() {
        assertThatThrownBy(() -> Validation.validateNotBlank(null, "field"))
                .isExactlyInstanceOf(IllegalArgumentException.class)
                .hasMessage("field must not be null or blank");
    }

    @Test
    void validateLength_returnsValueUntrimmed() {
        assertThat(Validation.validateLength(" */5 ", "minute", 10)).isEqualTo(" */5 ");
    }

    @Test
    void validateLength_boundaryIsInclusive() {
        assertThat(Validation.validateLength("abc", "field", 3)).isEqualTo("abc");
        assertThatThrownBy(() -> Validation.validateLength("abcd", "field", 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("field length must be between 1 and 3");
    }

    @ParameterizedTest
    @ValueSource(strings = {"UTC", "Europe/Vilnius", "America/Los_Angeles", "Asia/Kolkata"})
    void validateTimezone_acceptsIanaIds(final String zone) {
        assertThat(Validation.validateTimezone(zone, "timezone", 64)).isEqualTo(zone);
    }

    @Test
    void validateTimezone_wrapsZoneException() {
        assertThatThrownBy(() -> Validation.validateTimezone("Not/A_Zone", "timezone", 64))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("timezone is not a valid timezone: Not/A_Zone")
                .hasCauseInstanceOf(DateTimeException.class);
    }
}
