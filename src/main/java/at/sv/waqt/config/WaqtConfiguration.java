package at.sv.waqt.config;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * Turns raw user input into the validated location, time zone and settings used by the calculations.
 * <p>
 * Invalid values never fail: they are replaced by their documented defaults and reported as warning.
 */
@Slf4j
@Getter
public final class WaqtConfiguration {

    public static final double DEFAULT_TIME_ZONE = 3;
    public static final double MIN_TIME_ZONE = -13;
    public static final double MAX_TIME_ZONE = 15;

    private final Location location;
    private final double timeZone;
    private final CalculationMethod method;
    private final AsrMethod asrMethod;
    private final MinuteAdjustments adjustments;
    private final CalculationSettings settings;

    /**
     * @param latitude    in degrees (-90, 90)
     * @param longitude   in degrees [-180, 180)
     * @param timeZone    offset in hours [-13, 15]
     * @param method      the {@link CalculationMethod} name, ignoring case, or its index
     * @param asrMethod   the {@link AsrMethod} name, ignoring case, or its index
     * @param adjustments six minute adjustments: fajr, shurooq, dhohr, asr, maghrib, isha
     */
    @Builder
    private WaqtConfiguration(Double latitude, Double longitude, Double timeZone, String method, String asrMethod,
                              double[] adjustments) {
        this.location = resolveLocation(latitude, longitude);
        this.timeZone = resolveTimeZone(timeZone);
        this.method = resolve("calculation method", method, CalculationMethod::fromName, CalculationMethod::fromId,
                CalculationMethod.DEFAULT);
        this.asrMethod = resolve("asr method", asrMethod, AsrMethod::fromName, AsrMethod::fromId, AsrMethod.DEFAULT);
        this.adjustments = resolveAdjustments(adjustments);
        this.settings = CalculationSettings.of(this.method, this.asrMethod, this.adjustments);
    }

    public static WaqtConfiguration defaults() {
        return builder().build();
    }

    private static Location resolveLocation(Double latitude, Double longitude) {
        if (latitude == null && longitude == null) {
            return Location.DEFAULT;
        }
        if (latitude == null || longitude == null || !Location.isValid(latitude, longitude)) {
            log.warn("Invalid location [{},{}]. Using default {}", latitude, longitude, Location.DEFAULT);
            return Location.DEFAULT;
        }
        return new Location(latitude, longitude);
    }

    private static double resolveTimeZone(Double timeZone) {
        if (timeZone == null) {
            return DEFAULT_TIME_ZONE;
        }
        if (!(timeZone >= MIN_TIME_ZONE && timeZone <= MAX_TIME_ZONE)) {
            log.warn("Invalid time zone '{}'. Using default {}", timeZone, DEFAULT_TIME_ZONE);
            return DEFAULT_TIME_ZONE;
        }
        return timeZone;
    }

    private static <T extends Enum<T>> T resolve(String name, String input, Function<String, T> byName,
                                                 IntFunction<T> byId, T defaultValue) {
        if (input == null || input.isBlank()) {
            return defaultValue;
        }
        T value = byName.apply(input);
        if (value == null && isInteger(input)) {
            value = byId.apply(Integer.parseInt(input.trim()));
        }
        if (value == null) {
            log.warn("Unknown {} '{}'. Using default {}", name, input, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private static boolean isInteger(String input) {
        return input.trim().matches("[0-9]{1,9}");
    }

    private static MinuteAdjustments resolveAdjustments(double[] adjustments) {
        if (adjustments == null) {
            return MinuteAdjustments.NONE;
        }
        if (!MinuteAdjustments.isValid(adjustments)) {
            log.warn("Invalid minute adjustments {}. Expected six numbers, using no adjustments.",
                    Arrays.toString(adjustments));
            return MinuteAdjustments.NONE;
        }
        return MinuteAdjustments.of(adjustments);
    }

    @Override
    public String toString() {
        return "location=" + location +
               ", timeZone=" + timeZone +
               ", method=" + method.getDisplayName() +
               ", asrMethod=" + asrMethod.getDisplayName() +
               (adjustments.isNone() ? "" : ", adjustments=" + Arrays.toString(adjustments.toArray()));
    }
}
