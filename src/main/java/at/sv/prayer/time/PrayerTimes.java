package at.sv.prayer.time;

import at.sv.prayer.Prayer;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

import static at.sv.prayer.math.DegreeMath.fixHour;

/**
 * The times of one day. Times the sun position does not define on that day, and which were not replaced by a
 * high latitude adjustment, are unresolved: {@link #isResolved(Prayer)} returns false and their {@link HoursMinutes}
 * is {@link HoursMinutes#UNRESOLVED}.
 */
@EqualsAndHashCode
public final class PrayerTimes {

    private final Map<Prayer, Double> fractionalHours;
    private final Map<Prayer, HoursMinutes> times;
    private final Set<Prayer> unresolved;

    private PrayerTimes(Map<Prayer, Double> fractionalHours, Map<Prayer, HoursMinutes> times, Set<Prayer> unresolved) {
        this.fractionalHours = Collections.unmodifiableMap(fractionalHours);
        this.times = Collections.unmodifiableMap(times);
        this.unresolved = Collections.unmodifiableSet(unresolved);
    }

    static PrayerTimes of(RawEventTimes raw) {
        Map<Prayer, Double> fractionalHours = new EnumMap<>(Prayer.class);
        Map<Prayer, HoursMinutes> times = new EnumMap<>(Prayer.class);
        Set<Prayer> unresolved = EnumSet.noneOf(Prayer.class);
        for (Prayer prayer : Prayer.values()) {
            if (raw.isResolved(prayer)) {
                double value = raw.get(prayer);
                fractionalHours.put(prayer, fixHour(value));
                times.put(prayer, HoursMinutes.ofFractionalHours(value));
            } else {
                times.put(prayer, HoursMinutes.UNRESOLVED);
                unresolved.add(prayer);
            }
        }
        return new PrayerTimes(fractionalHours, times, unresolved);
    }

    public HoursMinutes get(Prayer prayer) {
        return times.get(prayer);
    }

    /**
     * @return the unrounded time in hours [0, 24), or empty if unresolved
     */
    public OptionalDouble getFractionalHours(Prayer prayer) {
        Double value = fractionalHours.get(prayer);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean isResolved(Prayer prayer) {
        return !unresolved.contains(prayer);
    }

    public Set<Prayer> getUnresolved() {
        return unresolved;
    }

    public HoursMinutes getImsak() {
        return get(Prayer.IMSAK);
    }

    public HoursMinutes getFajr() {
        return get(Prayer.FAJR);
    }

    public HoursMinutes getSunrise() {
        return get(Prayer.SUNRISE);
    }

    public HoursMinutes getDhuhr() {
        return get(Prayer.DHUHR);
    }

    public HoursMinutes getAsr() {
        return get(Prayer.ASR);
    }

    public HoursMinutes getSunset() {
        return get(Prayer.SUNSET);
    }

    public HoursMinutes getMaghrib() {
        return get(Prayer.MAGHRIB);
    }

    public HoursMinutes getIsha() {
        return get(Prayer.ISHA);
    }

    public HoursMinutes getMidnight() {
        return get(Prayer.MIDNIGHT);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Prayer prayer : Prayer.values()) {
            if (prayer.ordinal() > 0) {
                sb.append(", ");
            }
            sb.append(prayer.getDisplayName()).append('=').append(isResolved(prayer) ? get(prayer) : "--:--");
        }
        return sb.append('}').toString();
    }
}
