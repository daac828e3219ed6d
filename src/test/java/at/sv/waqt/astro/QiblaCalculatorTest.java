package at.sv.waqt.astro;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Random;

import static at.sv.waqt.astro.QiblaCalculator.KAABA_LATITUDE;
import static at.sv.waqt.astro.QiblaCalculator.KAABA_LONGITUDE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.both;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.notANumber;

class QiblaCalculatorTest {

    @ParameterizedTest
    @CsvSource({
            "51.5074, -0.1278, 118.987",
            "40.7128, -74.006, 58.482",
            "24.494647, 39.770508, 179.033",
            "-6.2088, 106.8456, 295.152",
    })
    void azimuth_knownCities(double latitude, double longitude, double expected) {
        assertThat(QiblaCalculator.azimuth(latitude, longitude), closeTo(expected, 0.01));
    }

    @Test
    void azimuth_northOfKaaba_pointsSouth() {
        assertThat(QiblaCalculator.azimuth(30, KAABA_LONGITUDE), closeTo(180, 1e-9));
    }

    @Test
    void azimuth_alwaysWithinRange() {
        Random random = new Random(17);
        for (int i = 0; i < 2000; i++) {
            double latitude = random.nextDouble() * 179.8 - 89.9;
            double longitude = random.nextDouble() * 360 - 180;

            double azimuth = QiblaCalculator.azimuth(latitude, longitude);

            assertThat(azimuth, is(both(greaterThanOrEqualTo(0.0)).and(lessThan(360.0))));
        }
    }

    @Test
    void azimuth_atKaaba_NaN() {
        assertThat(QiblaCalculator.azimuth(KAABA_LATITUDE, KAABA_LONGITUDE), is(notANumber()));
    }
}
