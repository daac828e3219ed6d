package at.sv.waqt.astro;

/**
 * Spherical trigonometry shared by the solar, lunar and qibla calculations.
 * <p>
 * Angles are in radians unless a method name says otherwise. Azimuths are returned in degrees, measured
 * clockwise from north and normalized into [0, 360).
 */
public final class PositionMath {

    private PositionMath() {
    }

    public static double cotangent(double rad) {
        return Math.tan(Math.PI / 2 - rad);
    }

    /**
     * Two-argument arc cotangent, keeping the quadrant of {@code x / y}.
     */
    public static double arccotangent2(double x, double y) {
        return Math.atan2(y, x);
    }

    public static double arccotangent2(double x) {
        return arccotangent2(x, 1);
    }

    /**
     * @param hourAngle   hour angle of the body, west of the meridian
     * @param declination declination of the body
     * @param latitude    latitude of the observer
     * @return altitude above the horizon in degrees
     */
    public static double altitude(double hourAngle, double declination, double latitude) {
        return Math.toDegrees(Math.asin(Math.sin(latitude) * Math.sin(declination) +
                                        Math.cos(latitude) * Math.cos(declination) * Math.cos(hourAngle)));
    }

    /**
     * @param hourAngle   hour angle of the body, west of the meridian
     * @param declination declination of the body
     * @param latitude    latitude of the observer
     * @return azimuth in degrees [0, 360)
     */
    public static double azimuth(double hourAngle, double declination, double latitude) {
        double azimuth = Math.toDegrees(Math.atan2(-Math.sin(hourAngle),
                Math.tan(declination) * Math.cos(latitude) - Math.sin(latitude) * Math.cos(hourAngle)));
        return normalizeAzimuth(azimuth);
    }

    /**
     * Initial great-circle bearing from one point to another, all coordinates in degrees.
     *
     * @return bearing in degrees [0, 360), or {@link Double#NaN} if the bearing is undefined, i.e. the
     * points coincide or are antipodal
     */
    public static double bearing(double fromLatitude, double fromLongitude, double toLatitude, double toLongitude) {
        double longitudeDifference = Math.toRadians(toLongitude - fromLongitude);
        double fromColatitude = Math.toRadians(90 - fromLatitude);
        double toColatitude = Math.toRadians(90 - toLatitude);

        double y = Math.sin(longitudeDifference);
        double x = Math.sin(fromColatitude) * cotangent(toColatitude) -
                   Math.cos(fromColatitude) * Math.cos(longitudeDifference);
        if (Math.abs(y) < 1e-12 && Math.abs(x) < 1e-12) {
            return Double.NaN;
        }
        return normalizeAzimuth(Math.toDegrees(Math.atan2(y, x)));
    }

    static double normalizeAzimuth(double degrees) {
        if (degrees < 0) {
            degrees += 360;
        }
        if (degrees >= 360) { // tiny negatives round up to exactly 360
            degrees -= 360;
        }
        return degrees + 0.0; // -0.0 becomes 0.0
    }
}
