package at.sv.waqt.config;

import java.util.Arrays;

/**
 * Minutes added to each calculated time, e.g. to follow a local mosque's timetable. Negative values move a
 * time earlier.
 */
public record MinuteAdjustments(double fajr, double shurooq, double dhohr, double asr, double maghrib, double isha) {

    public static final MinuteAdjustments NONE = new MinuteAdjustments(0, 0, 0, 0, 0, 0);

    private static final int COUNT = 6;

    /**
     * @param minutes exactly six values in the order fajr, shurooq, dhohr, asr, maghrib, isha
     * @throws IllegalArgumentException if not exactly six finite values are given
     */
    public static MinuteAdjustments of(double... minutes) {
        if (!isValid(minutes)) {
            throw new IllegalArgumentException("Expected " + COUNT + " finite minute adjustments, got " +
                                               Arrays.toString(minutes));
        }
        return new MinuteAdjustments(minutes[0], minutes[1], minutes[2], minutes[3], minutes[4], minutes[5]);
    }

    public static boolean isValid(double[] minutes) {
        return minutes != null && minutes.length == COUNT && Arrays.stream(minutes).allMatch(Double::isFinite);
    }

    public double[] toArray() {
        return new double[]{fajr, shurooq, dhohr, asr, maghrib, isha};
    }

    public boolean isNone() {
        return equals(NONE);
    }
}
