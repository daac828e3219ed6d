package at.sv.waqt.astro;

/**
 * The qibla, i.e. the initial great-circle bearing towards the Ka'aba.
 */
public final class QiblaCalculator {

    public static final double KAABA_LATITUDE = 21.422517;
    public static final double KAABA_LONGITUDE = 39.826166;

    private QiblaCalculator() {
    }

    /**
     * @return the qibla in degrees [0, 360) clockwise from north, or {@link Double#NaN} at the Ka'aba itself
     */
    public static double azimuth(double latitude, double longitude) {
        return PositionMath.bearing(latitude, longitude, KAABA_LATITUDE, KAABA_LONGITUDE);
    }
}
