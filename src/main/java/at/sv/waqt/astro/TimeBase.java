package at.sv.waqt.astro;

/**
 * Conversions between Unix time and Julian dates, and the reference instants of a calculation day.
 * <p>
 * All instants are Unix seconds as {@code double}. A day is always 86400 seconds, leap seconds are ignored.
 */
public final class TimeBase {

    public static final int SECONDS_PER_DAY = 86_400;
    /**
     * Seconds per degree of longitude, i.e. 15 degrees per hour.
     */
    public static final int SECONDS_PER_DEGREE = 240;

    /**
     * The Unix epoch (1970-01-01 0:00 UTC) as Julian date. The difference between UTC and TT is assumed constant.
     */
    static final double UNIX_EPOCH_JD = 2440587.500761306;
    /**
     * The J2000 epoch (2000-01-01 12:00 TT) as Julian date.
     */
    static final double J2000_EPOCH_JD = 2451545;

    private static final int DAYS_PER_CENTURY = 36525;

    private TimeBase() {
    }

    public static double toJulianDate(double unixSeconds) {
        return UNIX_EPOCH_JD + unixSeconds / SECONDS_PER_DAY;
    }

    public static double toUnix(double julianDate) {
        return SECONDS_PER_DAY * (julianDate - UNIX_EPOCH_JD);
    }

    static double daysSinceJ2000(double unixSeconds) {
        return toJulianDate(unixSeconds) - J2000_EPOCH_JD;
    }

    static double centuriesSinceJ2000(double unixSeconds) {
        return daysToCenturies(daysSinceJ2000(unixSeconds));
    }

    static double daysToCenturies(double days) {
        return days / DAYS_PER_CENTURY;
    }

    /**
     * Returns the local civil start of the calculation day that contains the given instant. The day is
     * shifted by one if the instant lies outside the solar midnights that bracket the civil day, which can
     * happen as the equation of time moves solar midnight across the day boundary.
     *
     * @param unixSeconds the instant to find the day for
     * @param timeZone    the time zone offset in hours
     * @param longitude   the longitude in degrees
     */
    public static double basetime(double unixSeconds, double timeZone, double longitude) {
        double dayBegin = Math.floor(unixSeconds / SECONDS_PER_DAY) * SECONDS_PER_DAY - timeZone * 3600;
        double midnight = midnight(dayBegin, timeZone, longitude);
        double nextMidnight = midnight(dayBegin + SECONDS_PER_DAY, timeZone, longitude);
        if (unixSeconds > nextMidnight) {
            return dayBegin + SECONDS_PER_DAY;
        }
        if (unixSeconds < midnight) {
            return dayBegin - SECONDS_PER_DAY;
        }
        return dayBegin;
    }

    /**
     * Mean local noon of the day starting at {@code basetime}, not yet corrected by the equation of time.
     */
    public static double midday(double basetime, double timeZone, double longitude) {
        return basetime + (180 + timeZone * 15 - longitude) * SECONDS_PER_DEGREE;
    }

    /**
     * True local solar midnight at the start of the day starting at {@code basetime}. The equation of time is
     * evaluated once at the mean midnight; the result is not iterated.
     */
    public static double midnight(double basetime, double timeZone, double longitude) {
        double meanMidnight = basetime + (timeZone * 15 - longitude) * SECONDS_PER_DEGREE;
        return meanMidnight - SolarEphemeris.equationOfTime(meanMidnight);
    }
}
