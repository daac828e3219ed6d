package at.sv.waqt.astro;

/**
 * Geocentric equatorial position.
 *
 * @param rightAscension the right ascension in radians (-pi, pi]
 * @param declination    the declination in radians
 * @param distance       the distance in earth radii
 */
public record EquatorialCoordinates(double rightAscension, double declination, double distance) {

    public double rightAscensionDegrees() {
        double degrees = Math.toDegrees(rightAscension);
        return degrees < 0 ? degrees + 360 : degrees;
    }

    public double declinationDegrees() {
        return Math.toDegrees(declination);
    }
}
