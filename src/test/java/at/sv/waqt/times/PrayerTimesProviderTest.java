package at.sv.waqt.times;

import at.sv.waqt.config.Location;
import at.sv.waqt.config.WaqtConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.core.Is.is;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PrayerTimesProviderTest {

    @Mock
    private PrayerTimeCalculator calculator;
    private ZonedDateTime dateTime;
    private WaqtConfiguration configuration;
    private PrayerTimesProvider provider;

    private void assertTime(ZonedDateTime time, int hour, int minute, int second) {
        assertThat("Time differs", time.toLocalTime(), is(LocalTime.of(hour, minute, second)));
    }

    @BeforeEach
    void setUp() {
        ZoneId zone = ZoneId.of("Europe/Vienna");
        dateTime = ZonedDateTime.of(2021, 1, 1, 0, 0, 0, 0, zone);
        configuration = WaqtConfiguration.builder()
                                         .latitude(48.20)
                                         .longitude(16.39)
                                         .timeZone(1.0)
                                         .method("Karachi")
                                         .build();
        provider = new PrayerTimesProviderImpl(configuration);
    }

    @Test
    void returnsCorrectTimes_dependingOnDate() {
        assertTime(provider.getFajr(dateTime), 5, 51, 5);
        assertTime(provider.getShurooq(dateTime), 7, 44, 56);
        assertTime(provider.getDhohr(dateTime), 11, 58, 6);
        assertTime(provider.getAsr(dateTime), 13, 53, 47);
        assertTime(provider.getMaghrib(dateTime), 16, 11, 16);
        assertTime(provider.getIsha(dateTime), 18, 5, 7);
        assertTime(provider.getNextMidnight(dateTime), 23, 58, 20);
        dateTime = dateTime.plusDays(30);
        assertTime(provider.getFajr(dateTime), 5, 35, 45);
        assertTime(provider.getShurooq(dateTime), 7, 23, 18);
        assertTime(provider.getDhohr(dateTime), 12, 7, 53);
        assertTime(provider.getAsr(dateTime), 14, 28, 55);
        assertTime(provider.getMaghrib(dateTime), 16, 52, 29);
        assertTime(provider.getIsha(dateTime), 18, 40, 2);
        assertTime(provider.getNextMidnight(dateTime), 0, 7, 58);
    }

    @Test
    void returnsCorrectTime_doesNotDependOnTimeOfDay() {
        assertTime(provider.getMaghrib(dateTime), 16, 11, 16);
        assertTime(provider.getMaghrib(dateTime.withHour(23).withMinute(59)), 16, 11, 16);
    }

    @Test
    void returnsTimesInZoneOfGivenDateTime() {
        ZonedDateTime utc = dateTime.withHour(11).withZoneSameInstant(ZoneId.of("UTC"));

        ZonedDateTime fajr = provider.getFajr(utc);

        assertThat(fajr.getZone(), is(ZoneId.of("UTC")));
        assertTime(fajr, 4, 51, 5);
    }

    @Test
    void toDebugString_listsAllTimes() {
        String debugString = provider.toDebugString(dateTime);

        assertThat(debugString, containsString("fajr: 05:51:05"));
        assertThat(debugString, containsString("isha: 18:05:07"));
        assertThat(debugString, containsString("next_midnight: 23:58:20"));
    }

    @Test
    void cachesTimesPerDay_untilCleared() {
        Instant instant = dateTime.toInstant();
        PrayerTimeSet timeSet = new PrayerTimeSet(instant, instant, instant, instant, instant, instant, instant,
                instant, false);
        when(calculator.calculate(any(), any(), anyDouble(), any())).thenReturn(timeSet);
        provider = new PrayerTimesProviderImpl(calculator, configuration);

        provider.getFajr(dateTime);
        provider.getIsha(dateTime.withHour(20));
        provider.getTimes(dateTime.withHour(23));

        verify(calculator, times(1)).calculate(eq(Instant.parse("2021-01-01T11:00:00Z")),
                eq(new Location(48.20, 16.39)), eq(1.0), eq(configuration.getSettings()));

        provider.getDhohr(dateTime.plusDays(1));
        provider.clearCache();
        provider.getDhohr(dateTime);

        verify(calculator, times(2)).calculate(eq(Instant.parse("2021-01-01T11:00:00Z")), any(), anyDouble(), any());
        verify(calculator, times(1)).calculate(eq(Instant.parse("2021-01-02T11:00:00Z")), any(), anyDouble(), any());
    }
}
