package at.sv.waqt.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WaqtConfigurationTest {

    @Test
    void defaults_medinaKarachiShafii() {
        WaqtConfiguration configuration = WaqtConfiguration.defaults();

        assertThat(configuration.getLocation()).isEqualTo(Location.DEFAULT);
        assertThat(configuration.getTimeZone()).isEqualTo(3);
        assertThat(configuration.getMethod()).isEqualTo(CalculationMethod.KARACHI);
        assertThat(configuration.getAsrMethod()).isEqualTo(AsrMethod.SHAFII);
        assertThat(configuration.getAdjustments()).isEqualTo(MinuteAdjustments.NONE);
        assertThat(configuration.getSettings().getFajrAngle()).isEqualTo(-18);
    }

    @Test
    void validInput_used() {
        WaqtConfiguration configuration = WaqtConfiguration.builder()
                                                            .latitude(48.2)
                                                            .longitude(16.39)
                                                            .timeZone(1.0)
                                                            .method("mwl")
                                                            .asrMethod("HANAFI")
                                                            .adjustments(new double[]{1, 0, 0, 0, 0, -2})
                                                            .build();

        assertThat(configuration.getLocation()).isEqualTo(new Location(48.2, 16.39));
        assertThat(configuration.getTimeZone()).isEqualTo(1);
        assertThat(configuration.getMethod()).isEqualTo(CalculationMethod.MWL);
        assertThat(configuration.getAsrMethod()).isEqualTo(AsrMethod.HANAFI);
        assertThat(configuration.getSettings().getIshaAngle()).isEqualTo(-17);
        assertThat(configuration.getSettings().getAdjustments().isha()).isEqualTo(-2);
    }

    @Test
    void methodById() {
        WaqtConfiguration configuration = WaqtConfiguration.builder().method("3").asrMethod(" 1 ").build();

        assertThat(configuration.getMethod()).isEqualTo(CalculationMethod.MAKKAH);
        assertThat(configuration.getAsrMethod()).isEqualTo(AsrMethod.HANAFI);
    }

    @Test
    void unknownMethod_default() {
        WaqtConfiguration configuration = WaqtConfiguration.builder().method("Jafari").asrMethod("7").build();

        assertThat(configuration.getMethod()).isEqualTo(CalculationMethod.KARACHI);
        assertThat(configuration.getAsrMethod()).isEqualTo(AsrMethod.SHAFII);
    }

    @Test
    void invalidLocation_default() {
        assertThat(WaqtConfiguration.builder().latitude(90.0).longitude(10.0).build().getLocation())
                .isEqualTo(Location.DEFAULT);
        assertThat(WaqtConfiguration.builder().latitude(10.0).longitude(180.0).build().getLocation())
                .isEqualTo(Location.DEFAULT);
        assertThat(WaqtConfiguration.builder().latitude(10.0).build().getLocation())
                .isEqualTo(Location.DEFAULT);
    }

    @Test
    void location_boundaries() {
        assertThat(WaqtConfiguration.builder().latitude(-89.99).longitude(-180.0).build().getLocation())
                .isEqualTo(new Location(-89.99, -180));
    }

    @Test
    void invalidTimeZone_default() {
        assertThat(WaqtConfiguration.builder().timeZone(16.0).build().getTimeZone()).isEqualTo(3);
        assertThat(WaqtConfiguration.builder().timeZone(-13.5).build().getTimeZone()).isEqualTo(3);
        assertThat(WaqtConfiguration.builder().timeZone(Double.NaN).build().getTimeZone()).isEqualTo(3);
        assertThat(WaqtConfiguration.builder().timeZone(5.75).build().getTimeZone()).isEqualTo(5.75);
        assertThat(WaqtConfiguration.builder().timeZone(-13.0).build().getTimeZone()).isEqualTo(-13);
    }

    @Test
    void invalidAdjustments_none() {
        WaqtConfiguration configuration = WaqtConfiguration.builder().adjustments(new double[]{1, 2}).build();

        assertThat(configuration.getAdjustments()).isEqualTo(MinuteAdjustments.NONE);
    }

    @Test
    void location_invalid_exception() {
        assertThatThrownBy(() -> new Location(-90, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Location(0, Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }
}
