package at.sv.prayer.time;

import java.time.LocalTime;

import static at.sv.prayer.math.DegreeMath.fixHour;

/**
 * A time of day rounded to the minute.
 *
 * @param hours   [0, 23]
 * @param minutes [0, 59]
 */
public record HoursMinutes(int hours, int minutes) {

    /**
     * Placeholder for times that could not be calculated.
     */
    public static final HoursMinutes UNRESOLVED = new HoursMinutes(0, 0);

    public HoursMinutes {
        if (hours < 0 || hours > 23 || minutes < 0 || minutes > 59) {
            throw new IllegalArgumentException("Invalid time " + hours + ":" + minutes);
        }
    }

    /**
     * Rounds the given hours to the nearest minute and reduces them to a time of day.
     *
     * @param fractionalHours any finite value
     */
    public static HoursMinutes ofFractionalHours(double fractionalHours) {
        double time = fixHour(fractionalHours + 0.5 / 60.0);
        int hours = (int) Math.floor(time);
        int minutes = (int) Math.floor((time - hours) * 60.0);
        return new HoursMinutes(hours, Math.min(minutes, 59));
    }

    public LocalTime toLocalTime() {
        return LocalTime.of(hours, minutes);
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT, "%02d:%02d", hours, minutes);
    }
}
