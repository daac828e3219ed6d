package at.sv.waqt.times;

import at.sv.waqt.config.AsrMethod;
import at.sv.waqt.config.CalculationMethod;
import at.sv.waqt.config.CalculationSettings;
import at.sv.waqt.config.Location;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.shredzone.commons.suncalc.SunTimes;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compares the prayer times in Vienna with the twilight times of commons-suncalc.
 */
class PrayerTimesSunCalcTest {

    private static final double LATITUDE = 48.20;
    private static final double LONGITUDE = 16.39;
    private static final ZoneId VIENNA = ZoneId.of("Europe/Vienna");

    private static void assertClose(Instant actual, ZonedDateTime expected, int seconds) {
        assertThat(expected).isNotNull();
        assertThat(Duration.between(actual, expected.toInstant()).abs())
                .as("%s vs %s", actual.atZone(VIENNA), expected)
                .isLessThanOrEqualTo(Duration.ofSeconds(seconds));
    }

    private static SunTimes sunTimes(ZonedDateTime midnight, SunTimes.Twilight twilight) {
        return SunTimes.compute()
                       .on(midnight)
                       .at(LATITUDE, LONGITUDE)
                       .twilight(twilight)
                       .execute();
    }

    @ParameterizedTest
    @ValueSource(strings = {"2021-01-01", "2021-01-31", "2021-03-01", "2021-10-15", "2021-12-01"})
    void karachi_matchesTwilightTimes(String date) {
        ZonedDateTime midnight = LocalDate.parse(date).atStartOfDay(VIENNA);
        double timeZone = midnight.getOffset().getTotalSeconds() / 3600.0;

        PrayerTimeSet times = new PrayerTimeCalculator().calculate(midnight.plusHours(12).toInstant(),
                new Location(LATITUDE, LONGITUDE), timeZone,
                CalculationSettings.of(CalculationMethod.KARACHI, AsrMethod.SHAFII));

        SunTimes astronomical = sunTimes(midnight, SunTimes.Twilight.ASTRONOMICAL);
        SunTimes visual = sunTimes(midnight, SunTimes.Twilight.VISUAL);
        assertThat(times.fallback()).isFalse();
        assertClose(times.fajr(), astronomical.getRise(), 90);
        assertClose(times.shurooq(), visual.getRise(), 120);
        assertClose(times.dhohr(), visual.getNoon(), 60);
        assertClose(times.maghrib(), visual.getSet(), 120);
        assertClose(times.isha(), astronomical.getSet(), 90);
    }
}
