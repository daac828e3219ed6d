package at.sv.waqt;

import at.sv.waqt.astro.LunarAccuracy;
import at.sv.waqt.astro.LunarEphemeris;
import at.sv.waqt.astro.QiblaCalculator;
import at.sv.waqt.astro.SolarEphemeris;
import at.sv.waqt.config.CalculationSettings;
import at.sv.waqt.config.Location;
import at.sv.waqt.times.PrayerTimeCalculator;
import at.sv.waqt.times.PrayerTimeSet;

import java.time.Instant;

/**
 * Entry point to all calculations. Every method is a pure function of its arguments.
 */
public final class WaqtCalculator {

    private final PrayerTimeCalculator prayerTimeCalculator = new PrayerTimeCalculator();

    /**
     * @param instant  any instant of the day to calculate
     * @param timeZone the time zone offset in hours, defining which local day the instant belongs to
     */
    public PrayerTimeSet prayerTimes(Instant instant, Location location, double timeZone, CalculationSettings settings) {
        return prayerTimeCalculator.calculate(instant, location, timeZone, settings);
    }

    /**
     * @return the direction to the Ka'aba in degrees [0, 360) clockwise from north, {@link Double#NaN} at the
     * Ka'aba itself
     */
    public double qiblaAzimuth(Location location) {
        return QiblaCalculator.azimuth(location.latitude(), location.longitude());
    }

    /**
     * @return the azimuth of the sun in degrees [0, 360) clockwise from north
     */
    public double sunAzimuth(Instant instant, Location location) {
        return SolarEphemeris.azimuth(toUnixSeconds(instant), location.latitude(), location.longitude());
    }

    /**
     * @return the azimuth of the moon in degrees [0, 360) clockwise from north
     */
    public double moonAzimuth(Instant instant, Location location, LunarAccuracy accuracy) {
        return LunarEphemeris.azimuth(toUnixSeconds(instant), location.latitude(), location.longitude(), accuracy);
    }

    /**
     * @param accuracy the accuracy level 0 to 3, other values use {@link LunarAccuracy#DEFAULT}
     */
    public double moonAzimuth(Instant instant, Location location, int accuracy) {
        return moonAzimuth(instant, location, LunarAccuracy.fromLevel(accuracy));
    }

    private static double toUnixSeconds(Instant instant) {
        return instant.getEpochSecond();
    }
}
