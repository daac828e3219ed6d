package at.sv.waqt.config;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * The sun angles and corrections used to derive the prayer times of a day. Usually created from one of the
 * {@link CalculationMethod presets}; the builder allows custom angles.
 */
@Builder(toBuilder = true)
@Getter
public final class CalculationSettings {

    /**
     * The altitude of the sun's centre at sunrise and sunset in degrees, including refraction and semi-diameter.
     */
    public static final double SUNSET_ANGLE = -0.8333;

    private final double fajrAngle;
    private final double ishaAngle;
    /**
     * Minutes added to isha, for methods defining isha as a fixed time after maghrib.
     */
    private final int ishaMinutes;
    @NonNull
    @Builder.Default
    private final AsrMethod asrMethod = AsrMethod.DEFAULT;
    @NonNull
    @Builder.Default
    private final MinuteAdjustments adjustments = MinuteAdjustments.NONE;

    public static CalculationSettings of(CalculationMethod method, AsrMethod asrMethod, MinuteAdjustments adjustments) {
        return CalculationSettings.builder()
                                  .fajrAngle(method.getFajrAngle())
                                  .ishaAngle(method.getIshaAngle())
                                  .ishaMinutes(method.getIshaMinutes())
                                  .asrMethod(asrMethod)
                                  .adjustments(adjustments)
                                  .build();
    }

    public static CalculationSettings of(CalculationMethod method, AsrMethod asrMethod) {
        return of(method, asrMethod, MinuteAdjustments.NONE);
    }

    public int getAsrShadowFactor() {
        return asrMethod.getShadowFactor();
    }

    @Override
    public String toString() {
        return "(fajr=" + fajrAngle +
               ", isha=" + ishaAngle +
               (ishaMinutes != 0 ? ", ishaMinutes=" + ishaMinutes : "") +
               ", asr=" + asrMethod +
               (adjustments.isNone() ? "" : ", adjustments=" + adjustments) +
               ")";
    }
}
