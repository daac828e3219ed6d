package at.sv.waqt.times;

import java.time.Instant;
import java.util.List;

/**
 * The times of one calculation day, ordered chronologically from the solar midnight that starts the day to the
 * solar midnight that ends it.
 *
 * @param dayStart     local solar midnight at the start of the day
 * @param nextMidnight local solar midnight at the end of the day
 * @param fallback     {@code true} if the times are proportional approximations, because the sun does not reach
 *                     the configured angles at this location and date
 */
public record PrayerTimeSet(Instant dayStart, Instant fajr, Instant shurooq, Instant dhohr, Instant asr,
                            Instant maghrib, Instant isha, Instant nextMidnight, boolean fallback) {

    public Instant get(Prayer prayer) {
        return switch (prayer) {
            case FAJR -> fajr;
            case SHUROOQ -> shurooq;
            case DHOHR -> dhohr;
            case ASR -> asr;
            case MAGHRIB -> maghrib;
            case ISHA -> isha;
        };
    }

    /**
     * @return all eight instants in chronological order
     */
    public List<Instant> toList() {
        return List.of(dayStart, fajr, shurooq, dhohr, asr, maghrib, isha, nextMidnight);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(dayStart) && !instant.isAfter(nextMidnight);
    }
}
