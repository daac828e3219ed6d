package at.sv.waqt.config;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Juristic conventions for asr, defined by the length of an object's shadow relative to the object itself.
 */
@Getter
@RequiredArgsConstructor
public enum AsrMethod {
    SHAFII("Shafii", 1),
    HANAFI("Hanafi", 2);

    public static final AsrMethod DEFAULT = SHAFII;

    private final String displayName;
    /**
     * Shadow length in units of object height, on top of the shadow at noon.
     */
    private final int shadowFactor;

    public static AsrMethod fromName(String name) {
        if (name == null) {
            return DEFAULT;
        }
        String lowerCase = name.trim().toLowerCase(Locale.ENGLISH);
        for (AsrMethod method : values()) {
            if (method.displayName.toLowerCase(Locale.ENGLISH).equals(lowerCase)) {
                return method;
            }
        }
        return null;
    }

    public static AsrMethod fromId(int id) {
        AsrMethod[] methods = values();
        if (id < 0 || id >= methods.length) {
            return null;
        }
        return methods[id];
    }
}
