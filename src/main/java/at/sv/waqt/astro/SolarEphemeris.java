package at.sv.waqt.astro;

import static at.sv.waqt.astro.TimeBase.centuriesSinceJ2000;
import static at.sv.waqt.astro.TimeBase.daysSinceJ2000;

/**
 * Low precision position of the sun, accurate to well under a minute of time for the prayer calculations.
 * <p>
 * Instants are Unix seconds, {@code t} is Julian centuries since J2000. Angles are in radians unless noted.
 */
public final class SolarEphemeris {

    // Greenwich mean sidereal time
    private static final double SIDEREAL_1 = 6.697374558;
    private static final double SIDEREAL_2 = 0.06570982441908;
    private static final double SIDEREAL_3 = 1.002737909350795;
    private static final double SIDEREAL_4 = 0.000026;

    // Obliquity of the ecliptic
    private static final double OBLIQUITY_1 = 0.40909;
    private static final double OBLIQUITY_2 = -0.0002295;

    // Mean longitude, mean anomaly and equation of centre
    private static final double MEAN_LONGITUDE_1 = 4.89506;
    private static final double MEAN_LONGITUDE_2 = 628.33197;
    private static final double MEAN_ANOMALY_1 = 6.24006;
    private static final double MEAN_ANOMALY_2 = 628.30195;
    private static final double CENTER_1 = 0.03342;
    private static final double CENTER_2 = -0.0000873;
    private static final double CENTER_3 = 0.000349;

    private static final double SECONDS_PER_RADIAN = 43200 / Math.PI;
    private static final int SUN_TIME_ITERATIONS = 2;

    private SolarEphemeris() {
    }

    static double meanLongitude(double t) {
        return MEAN_LONGITUDE_1 + MEAN_LONGITUDE_2 * t;
    }

    static double obliquity(double t) {
        return OBLIQUITY_1 + OBLIQUITY_2 * t;
    }

    public static double trueLongitude(double t) {
        double meanAnomaly = MEAN_ANOMALY_1 + MEAN_ANOMALY_2 * t;
        double center = (CENTER_1 + CENTER_2 * t) * Math.sin(meanAnomaly) + CENTER_3 * Math.sin(2 * meanAnomaly);
        return meanLongitude(t) + center;
    }

    public static double declination(double unixSeconds) {
        double t = centuriesSinceJ2000(unixSeconds);
        return Math.asin(Math.sin(trueLongitude(t)) * Math.sin(obliquity(t)));
    }

    /**
     * The right ascension, kept in the same half-plane as the true longitude. A plain {@code atan} of
     * {@code tan(L) cos(K)} would be off by pi from late June to late December.
     */
    public static double rightAscension(double t) {
        double trueLongitude = trueLongitude(t);
        return Math.atan2(Math.sin(trueLongitude) * Math.cos(obliquity(t)), Math.cos(trueLongitude));
    }

    /**
     * @return the equation of time in seconds, mean minus apparent solar time, within [-12h, 12h)
     */
    public static double equationOfTime(double unixSeconds) {
        double t = centuriesSinceJ2000(unixSeconds);
        double deltaT = meanLongitude(t) - rightAscension(t);
        deltaT -= Math.floor((deltaT + Math.PI) / Math.PI / 2) * 2 * Math.PI;
        return deltaT * SECONDS_PER_RADIAN;
    }

    /**
     * @param longitude the longitude in degrees, east positive
     * @return the local mean sidereal time in hours, not reduced to [0, 24)
     */
    public static double meanSiderealTime(double unixSeconds, double longitude) {
        double days = daysSinceJ2000(unixSeconds);
        double previousMidnight = Math.floor(days) - 0.5 + (fraction(days) >= 0.5 ? 1 : 0);
        double universalHours = 24 * (days - previousMidnight);
        double t = TimeBase.daysToCenturies(days);
        return SIDEREAL_1 + SIDEREAL_2 * previousMidnight + SIDEREAL_3 * universalHours +
               SIDEREAL_4 * t * t + longitude / 15;
    }

    static double hourAngle(double unixSeconds, double longitude, double rightAscension) {
        return Math.toRadians(meanSiderealTime(unixSeconds, longitude) * 15) - rightAscension;
    }

    /**
     * @return the altitude of the sun in degrees for an observer at the given latitude and longitude in degrees
     */
    public static double altitude(double unixSeconds, double latitude, double longitude) {
        double rightAscension = rightAscension(centuriesSinceJ2000(unixSeconds));
        return PositionMath.altitude(hourAngle(unixSeconds, longitude, rightAscension), declination(unixSeconds),
                Math.toRadians(latitude));
    }

    /**
     * @return the azimuth of the sun in degrees [0, 360) for an observer at the given latitude and longitude in degrees
     */
    public static double azimuth(double unixSeconds, double latitude, double longitude) {
        double rightAscension = rightAscension(centuriesSinceJ2000(unixSeconds));
        return PositionMath.azimuth(hourAngle(unixSeconds, longitude, rightAscension), declination(unixSeconds),
                Math.toRadians(latitude));
    }

    /**
     * Solves for the time from local noon at which the sun reaches the given altitude. Two fixed-point passes
     * are done, re-evaluating the declination at the previous estimate; the result is not iterated to
     * convergence.
     *
     * @param altitude    the target altitude in radians
     * @param unixSeconds the local noon the result is relative to
     * @param latitude    the latitude in degrees
     * @return the unsigned offset from noon in seconds, or {@link Double#NaN} if the sun never reaches the
     * altitude on that day at that latitude
     */
    public static double sunTime(double altitude, double unixSeconds, double latitude) {
        double latitudeRad = Math.toRadians(latitude);
        double sunTime = 0;
        for (int i = 0; i < SUN_TIME_ITERATIONS; i++) {
            double declination = declination(unixSeconds + sunTime);
            double cosHourAngle = (Math.sin(altitude) - Math.sin(declination) * Math.sin(latitudeRad)) /
                                  (Math.cos(declination) * Math.cos(latitudeRad));
            if (cosHourAngle < -1 || cosHourAngle > 1) {
                return Double.NaN;
            }
            sunTime = Math.acos(cosHourAngle) * SECONDS_PER_RADIAN;
        }
        return sunTime;
    }

    private static double fraction(double value) {
        return value - Math.floor(value);
    }
}
