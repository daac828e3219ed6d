package at.sv.waqt.times;

import java.util.Locale;

/**
 * The daily times of a {@link PrayerTimeSet}, in chronological order. Shurooq (sunrise) is not a prayer but ends
 * the time of fajr.
 */
public enum Prayer {
    FAJR,
    SHUROOQ,
    DHOHR,
    ASR,
    MAGHRIB,
    ISHA;

    public String getKey() {
        return name().toLowerCase(Locale.ENGLISH);
    }
}
