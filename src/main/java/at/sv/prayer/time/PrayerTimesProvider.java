package at.sv.prayer.time;

import at.sv.prayer.Prayer;

import java.time.LocalDate;
import java.time.ZonedDateTime;

public interface PrayerTimesProvider {

    /**
     * @param date the calendar date in the time zone of the location
     * @return the times of the given date
     */
    PrayerTimes getPrayerTimes(LocalDate date);

    /**
     * @param dateTime only the date part is used, the time of day does not influence the result
     */
    default PrayerTimes getPrayerTimes(ZonedDateTime dateTime) {
        return getPrayerTimes(dateTime.toLocalDate());
    }

    default HoursMinutes getTime(Prayer prayer, LocalDate date) {
        return getPrayerTimes(date).get(prayer);
    }

    default HoursMinutes getFajr(LocalDate date) {
        return getTime(Prayer.FAJR, date);
    }

    default HoursMinutes getDhuhr(LocalDate date) {
        return getTime(Prayer.DHUHR, date);
    }

    default HoursMinutes getAsr(LocalDate date) {
        return getTime(Prayer.ASR, date);
    }

    default HoursMinutes getMaghrib(LocalDate date) {
        return getTime(Prayer.MAGHRIB, date);
    }

    default HoursMinutes getIsha(LocalDate date) {
        return getTime(Prayer.ISHA, date);
    }

    /**
     * @return all times of the given date, one per line
     */
    String toDebugString(LocalDate date);
}
