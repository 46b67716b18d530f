package at.sv.prayer.config;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * A place on earth together with the time zone its times are expressed in.
 * Coordinates are not validated, values outside [-90, 90] and [-180, 180] give degenerate times.
 *
 * @param latitude  degrees, north positive
 * @param longitude degrees, east positive
 */
public record Location(double latitude, double longitude, ZoneId zone) {

    public Location {
        if (zone == null) {
            throw new InvalidCalculationConfig("Time zone must not be null");
        }
    }

    /**
     * @param zoneId a time zone identifier known to the JDK, e.g. {@code Europe/Vienna}
     * @throws InvalidCalculationConfig if the identifier is malformed or unknown
     */
    public static Location of(double latitude, double longitude, String zoneId) {
        return new Location(latitude, longitude, parseZone(zoneId));
    }

    private static ZoneId parseZone(String zoneId) {
        if (zoneId == null) {
            throw new InvalidCalculationConfig("Time zone must not be null");
        }
        try {
            return ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            throw new InvalidCalculationConfig("Invalid time zone '" + zoneId + "': " + e.getMessage(), e);
        }
    }

    /**
     * @return the offset from UTC in hours at the start of the given date, taking daylight saving time into account
     */
    public double offsetHoursOn(LocalDate date) {
        return date.atStartOfDay(zone).getOffset().getTotalSeconds() / 3600.0;
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ", " + zone + ")";
    }
}
