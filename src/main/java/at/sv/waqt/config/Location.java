package at.sv.waqt.config;

/**
 * A validated observer location in degrees.
 *
 * @param latitude  north positive, within (-90, 90)
 * @param longitude east positive, within [-180, 180)
 */
public record Location(double latitude, double longitude) {

    /**
     * Masjid an-Nabawi, used whenever the given coordinates are invalid.
     */
    public static final Location DEFAULT = new Location(24.494647, 39.770508);

    public Location {
        if (!isValid(latitude, longitude)) {
            throw new IllegalArgumentException("Invalid location: " + latitude + ", " + longitude);
        }
    }

    public static boolean isValid(double latitude, double longitude) {
        return latitude > -90 && latitude < 90 && longitude >= -180 && longitude < 180;
    }

    @Override
    public String toString() {
        return "[" + latitude + "," + longitude + ']';
    }
}
