package at.sv.waqt.times;

import at.sv.waqt.config.WaqtConfiguration;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Prayer times of a fixed configuration, cached per local date.
 * <p>
 * The date of the given date time is interpreted in the configured time zone offset. Times are calculated for
 * local noon of that date, so the result does not depend on the time of day.
 */
public final class PrayerTimesProviderImpl implements PrayerTimesProvider {

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final int MAX_CACHED_DAYS = 400;

    private final PrayerTimeCalculator calculator;
    private final WaqtConfiguration configuration;
    private final ZoneOffset offset;
    private final Cache<LocalDate, PrayerTimeSet> cache;

    public PrayerTimesProviderImpl(WaqtConfiguration configuration) {
        this(new PrayerTimeCalculator(), configuration);
    }

    PrayerTimesProviderImpl(PrayerTimeCalculator calculator, WaqtConfiguration configuration) {
        this.calculator = calculator;
        this.configuration = configuration;
        offset = ZoneOffset.ofTotalSeconds((int) Math.round(configuration.getTimeZone() * 3600));
        cache = Caffeine.newBuilder()
                        .maximumSize(MAX_CACHED_DAYS)
                        .build();
    }

    @Override
    public PrayerTimeSet getTimes(ZonedDateTime dateTime) {
        LocalDate date = dateTime.withZoneSameInstant(offset).toLocalDate();
        return cache.get(date, this::calculate);
    }

    private PrayerTimeSet calculate(LocalDate date) {
        Instant noon = date.atTime(LocalTime.NOON).toInstant(offset);
        return calculator.calculate(noon, configuration.getLocation(), configuration.getTimeZone(),
                configuration.getSettings());
    }

    @Override
    public ZonedDateTime getFajr(ZonedDateTime dateTime) {
        return get(dateTime, Prayer.FAJR);
    }

    @Override
    public ZonedDateTime getShurooq(ZonedDateTime dateTime) {
        return get(dateTime, Prayer.SHUROOQ);
    }

    @Override
    public ZonedDateTime getDhohr(ZonedDateTime dateTime) {
        return get(dateTime, Prayer.DHOHR);
    }

    @Override
    public ZonedDateTime getAsr(ZonedDateTime dateTime) {
        return get(dateTime, Prayer.ASR);
    }

    @Override
    public ZonedDateTime getMaghrib(ZonedDateTime dateTime) {
        return get(dateTime, Prayer.MAGHRIB);
    }

    @Override
    public ZonedDateTime getIsha(ZonedDateTime dateTime) {
        return get(dateTime, Prayer.ISHA);
    }

    @Override
    public ZonedDateTime getNextMidnight(ZonedDateTime dateTime) {
        return getTimes(dateTime).nextMidnight().atZone(dateTime.getZone());
    }

    private ZonedDateTime get(ZonedDateTime dateTime, Prayer prayer) {
        return getTimes(dateTime).get(prayer).atZone(dateTime.getZone());
    }

    @Override
    public String toDebugString(ZonedDateTime dateTime) {
        PrayerTimeSet times = getTimes(dateTime);
        return "day_start: " + format(times.dayStart(), dateTime) +
               "\nfajr: " + format(times.fajr(), dateTime) +
               "\nshurooq: " + format(times.shurooq(), dateTime) +
               "\ndhohr: " + format(times.dhohr(), dateTime) +
               "\nasr: " + format(times.asr(), dateTime) +
               "\nmaghrib: " + format(times.maghrib(), dateTime) +
               "\nisha: " + format(times.isha(), dateTime) +
               "\nnext_midnight: " + format(times.nextMidnight(), dateTime) +
               (times.fallback() ? "\n(proportional fallback)" : "");
    }

    @Override
    public void clearCache() {
        cache.invalidateAll();
    }

    private String format(Instant time, ZonedDateTime dateTime) {
        return TIME_FORMATTER.format(time.atZone(dateTime.getZone()));
    }
}
