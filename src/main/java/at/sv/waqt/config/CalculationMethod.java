package at.sv.waqt.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * The supported conventions for the sun angles of fajr and isha.
 */
@Getter
@RequiredArgsConstructor
public enum CalculationMethod {
    /**
     * University of Islamic Sciences, Karachi.
     */
    KARACHI("Karachi", -18, -18, 0),
    /**
     * Islamic Society of North America.
     */
    ISNA("ISNA", -15, -15, 0),
    /**
     * Muslim World League.
     */
    MWL("MWL", -18, -17, 0),
    /**
     * Umm al-Qura, Makkah: isha is a fixed time after maghrib.
     */
    MAKKAH("Makkah", -19, CalculationSettings.SUNSET_ANGLE, 90),
    /**
     * Egyptian General Authority of Survey.
     */
    EGYPT("Egypt", -19.5, -17.5, 0);

    public static final CalculationMethod DEFAULT = KARACHI;

    private final String displayName;
    private final double fajrAngle;
    private final double ishaAngle;
    private final int ishaMinutes;

    /**
     * @return the method with the given name ignoring case, {@link #DEFAULT} for {@code null}, or {@code null}
     * if no method has that name
     */
    public static CalculationMethod fromName(String name) {
        if (name == null) {
            return DEFAULT;
        }
        String lowerCase = name.trim().toLowerCase(Locale.ENGLISH);
        for (CalculationMethod method : values()) {
            if (method.displayName.toLowerCase(Locale.ENGLISH).equals(lowerCase)) {
                return method;
            }
        }
        return null;
    }

    /**
     * @return the method at the given index, or {@code null} if the index is out of range
     */
    public static CalculationMethod fromId(int id) {
        CalculationMethod[] methods = values();
        if (id < 0 || id >= methods.length) {
            return null;
        }
        return methods[id];
    }

    public int getId() {
        return ordinal();
    }
}
