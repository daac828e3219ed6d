package at.sv.waqt.astro;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Accuracy levels of the lunar position, each one adding to the corrections of the previous level.
 */
@Slf4j
@RequiredArgsConstructor
public enum LunarAccuracy {
    /**
     * Elliptical orbit from the mean anomaly only.
     */
    MEAN_ORBIT(0),
    /**
     * Eccentric anomaly refined by solving Kepler's equation.
     */
    KEPLER(1),
    /**
     * Adds evection, variation and the annual equation.
     */
    PERTURBED(2),
    /**
     * Adds the secondary perturbation terms.
     */
    FULLY_PERTURBED(3);

    public static final LunarAccuracy DEFAULT = PERTURBED;

    private final int level;

    /**
     * @param level the accuracy level 0 to 3
     * @return the matching accuracy, or {@link #DEFAULT} for any other level
     */
    public static LunarAccuracy fromLevel(int level) {
        for (LunarAccuracy accuracy : values()) {
            if (accuracy.level == level) {
                return accuracy;
            }
        }
        log.warn("Unsupported lunar accuracy level {}, using {}", level, DEFAULT.level);
        return DEFAULT;
    }

    boolean includes(LunarAccuracy other) {
        return level >= other.level;
    }
}
