package at.sv.waqt.times;

import java.time.ZonedDateTime;

public interface PrayerTimesProvider {

    /**
     * @param dateTime any time of the local date to get the prayer times for; its zone is used for the results
     */
    PrayerTimeSet getTimes(ZonedDateTime dateTime);

    ZonedDateTime getFajr(ZonedDateTime dateTime);

    ZonedDateTime getShurooq(ZonedDateTime dateTime);

    ZonedDateTime getDhohr(ZonedDateTime dateTime);

    ZonedDateTime getAsr(ZonedDateTime dateTime);

    ZonedDateTime getMaghrib(ZonedDateTime dateTime);

    ZonedDateTime getIsha(ZonedDateTime dateTime);

    ZonedDateTime getNextMidnight(ZonedDateTime dateTime);

    default String toDebugString(ZonedDateTime dateTime) {
        return null;
    }

    void clearCache();
}
