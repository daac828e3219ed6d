package at.sv.waqt.times;

import at.sv.waqt.astro.PositionMath;
import at.sv.waqt.astro.SolarEphemeris;
import at.sv.waqt.astro.TimeBase;
import at.sv.waqt.config.CalculationSettings;
import at.sv.waqt.config.Location;
import at.sv.waqt.config.MinuteAdjustments;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Arrays;
import java.util.OptionalDouble;

import static at.sv.waqt.astro.SolarEphemeris.equationOfTime;
import static at.sv.waqt.astro.SolarEphemeris.sunTime;
import static at.sv.waqt.astro.TimeBase.SECONDS_PER_DAY;
import static at.sv.waqt.astro.TimeBase.SECONDS_PER_DEGREE;
import static at.sv.waqt.config.CalculationSettings.SUNSET_ANGLE;

/**
 * Calculates the prayer times of the day containing a given instant.
 * <p>
 * The times are defined by the altitude of the sun. Where the sun does not reach the configured angles, e.g. in
 * summer at high latitudes, the times are computed for a latitude closer to the equator instead. If even that
 * fails, the times are approximated proportionally from noon.
 * <p>
 * Instances are stateless and may be shared between threads.
 */
@Slf4j
public final class PrayerTimeCalculator {

    /**
     * Fraction by which the allowed altitude range at midnight and noon is widened.
     */
    static final double OVERHEAD = 0.05;
    /**
     * Minimum altitude of the sun at noon in degrees, before widening.
     */
    static final double LATITUDE_UPPER = 0;
    /**
     * Tolerance in degrees after moving the latitude towards the equator.
     */
    static final double ERROR_MARGIN = 0.1;

    public PrayerTimeSet calculate(Instant instant, Location location, double timeZone, CalculationSettings settings) {
        double time = instant.getEpochSecond();
        double latitude = location.latitude();
        double longitude = location.longitude();

        double basetime = TimeBase.basetime(time, timeZone, longitude);
        double midnight = TimeBase.midnight(basetime, timeZone, longitude);
        double nextMidnight = TimeBase.midnight(basetime + SECONDS_PER_DAY, timeZone, longitude);
        double midday = TimeBase.midday(basetime, timeZone, longitude);
        double dhohr = midday - equationOfTime(midday);

        OptionalDouble workingLatitude = workingLatitude(latitude, longitude, midnight, dhohr, settings);
        double[] times = null;
        if (workingLatitude.isPresent()) {
            times = geometricTimes(midday, dhohr, workingLatitude.getAsDouble(), settings);
            if (Arrays.stream(times).anyMatch(Double::isNaN)) {
                log.warn("Undefined prayer time at {} for {}. Using proportional times.", location, instant);
                times = null;
            }
        }
        boolean fallback = times == null;
        if (fallback) {
            times = proportionalTimes(dhohr, settings);
        }
        applyAdjustments(times, settings.getAdjustments());

        return new PrayerTimeSet(toInstant(midnight),
                toInstant(times[Prayer.FAJR.ordinal()]),
                toInstant(times[Prayer.SHUROOQ.ordinal()]),
                toInstant(times[Prayer.DHOHR.ordinal()]),
                toInstant(times[Prayer.ASR.ordinal()]),
                toInstant(times[Prayer.MAGHRIB.ordinal()]),
                toInstant(times[Prayer.ISHA.ordinal()]),
                toInstant(nextMidnight),
                fallback);
    }

    /**
     * Checks if the sun is low enough at midnight and high enough at noon for all configured angles, and if not,
     * finds a latitude closer to the equator where it is.
     *
     * @return the latitude to calculate the times for, or empty if no such latitude is found and the proportional
     * times have to be used
     */
    static OptionalDouble workingLatitude(double latitude, double longitude, double midnight, double dhohr,
                                          CalculationSettings settings) {
        double lower = lowestAngle(settings);
        double upper = LATITUDE_UPPER;
        double difference = upper - lower;
        upper += difference * OVERHEAD;
        lower -= difference * OVERHEAD;

        double midnightAltitude = SolarEphemeris.altitude(midnight, latitude, longitude);
        double dhohrAltitude = SolarEphemeris.altitude(dhohr, latitude, longitude);
        if (midnightAltitude <= lower && dhohrAltitude >= upper) {
            return OptionalDouble.of(latitude);
        }

        double adjust = Math.max(midnightAltitude - lower, upper - dhohrAltitude);
        if (Math.abs(latitude) < adjust) {
            log.debug("Sun altitude at midnight {} and noon {} can't be corrected at latitude {}.",
                    midnightAltitude, dhohrAltitude, latitude);
            return OptionalDouble.empty();
        }
        double shiftedLatitude = latitude > 0 ? latitude - adjust : latitude + adjust;
        if (SolarEphemeris.altitude(midnight, shiftedLatitude, longitude) - lower > ERROR_MARGIN ||
            upper - SolarEphemeris.altitude(dhohr, shiftedLatitude, longitude) > ERROR_MARGIN) {
            log.debug("Latitude correction from {} to {} out of tolerance.", latitude, shiftedLatitude);
            return OptionalDouble.empty();
        }
        log.debug("Using latitude {} instead of {}.", shiftedLatitude, latitude);
        return OptionalDouble.of(shiftedLatitude);
    }

    /**
     * The lowest configured angle. The asr value is its juristic method (0 or 1), compared as is; being never
     * negative, it does not lower the bound.
     */
    private static double lowestAngle(CalculationSettings settings) {
        double asrValue = settings.getAsrShadowFactor() - 1;
        return Math.min(Math.min(settings.getFajrAngle(), settings.getIshaAngle()), asrValue);
    }

    private static double[] geometricTimes(double midday, double dhohr, double latitude, CalculationSettings settings) {
        double[] times = new double[Prayer.values().length];
        times[Prayer.FAJR.ordinal()] = beforeNoon(midday, settings.getFajrAngle(), latitude);
        times[Prayer.SHUROOQ.ordinal()] = beforeNoon(midday, SUNSET_ANGLE, latitude);
        times[Prayer.DHOHR.ordinal()] = dhohr;
        times[Prayer.ASR.ordinal()] = asr(midday, latitude, settings.getAsrShadowFactor());
        times[Prayer.MAGHRIB.ordinal()] = afterNoon(midday, SUNSET_ANGLE, latitude);
        times[Prayer.ISHA.ordinal()] = afterNoon(midday, settings.getIshaAngle(), latitude) +
                                       settings.getIshaMinutes() * 60;
        return times;
    }

    private static double beforeNoon(double midday, double angle, double latitude) {
        double time = midday - sunTime(Math.toRadians(angle), midday, latitude);
        return time - equationOfTime(time);
    }

    private static double afterNoon(double midday, double angle, double latitude) {
        double time = midday + sunTime(Math.toRadians(angle), midday, latitude);
        return time - equationOfTime(time);
    }

    /**
     * Asr starts when an object's shadow equals its noon shadow plus {@code shadowFactor} times its height.
     */
    private static double asr(double midday, double latitude, int shadowFactor) {
        double declination = SolarEphemeris.declination(midday);
        double noonZenith = Math.abs(Math.toRadians(latitude) - declination);
        double angle = PositionMath.arccotangent2(shadowFactor + Math.tan(noonZenith));
        double time = midday + sunTime(angle, midday, latitude);
        return time - equationOfTime(time);
    }

    /**
     * Approximates the times by assuming the sun moves a constant 15 degrees per hour from its noon position.
     */
    static double[] proportionalTimes(double dhohr, CalculationSettings settings) {
        double[] times = new double[Prayer.values().length];
        times[Prayer.FAJR.ordinal()] = dhohr - (90 - settings.getFajrAngle()) * SECONDS_PER_DEGREE;
        times[Prayer.SHUROOQ.ordinal()] = dhohr - (90 - SUNSET_ANGLE) * SECONDS_PER_DEGREE;
        times[Prayer.DHOHR.ordinal()] = dhohr;
        times[Prayer.ASR.ordinal()] = dhohr + Math.atan(settings.getAsrShadowFactor()) / Math.PI * 43200;
        times[Prayer.MAGHRIB.ordinal()] = dhohr + (90 - SUNSET_ANGLE) * SECONDS_PER_DEGREE;
        times[Prayer.ISHA.ordinal()] = dhohr + (90 - settings.getIshaAngle()) * SECONDS_PER_DEGREE;
        return times;
    }

    private static void applyAdjustments(double[] times, MinuteAdjustments adjustments) {
        double[] minutes = adjustments.toArray();
        for (int i = 0; i < times.length; i++) {
            times[i] += minutes[i] * 60;
        }
    }

    private static Instant toInstant(double unixSeconds) {
        return Instant.ofEpochSecond(Math.round(unixSeconds));
    }
}
