package at.sv.prayer;

import at.sv.prayer.config.AsrFactor;
import at.sv.prayer.config.CalculationConfig;
import at.sv.prayer.config.Convention;
import at.sv.prayer.config.HighLatitudeMethod;
import at.sv.prayer.config.Location;
import at.sv.prayer.config.TuningOffsets;
import at.sv.prayer.time.PrayerTimes;
import at.sv.prayer.time.PrayerTimesCalculator;

import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Entry points for one-off calculations. Use {@link at.sv.prayer.time.PrayerTimesProviderImpl} to calculate
 * multiple days for the same location.
 */
public final class PrayTimes {

    public static final double DEFAULT_LATITUDE = -33.7640187;
    public static final double DEFAULT_LONGITUDE = 150.8202351;

    private PrayTimes() {
    }

    /**
     * Calculates today's times in the system time zone for the reference location in western Sydney, with the
     * Jafari convention and angle based high latitude adjustment.
     */
    public static PrayerTimes computeDefault() {
        ZoneId zone = ZoneId.systemDefault();
        return computeDefault(LocalDate.now(zone), zone);
    }

    public static PrayerTimes computeDefault(LocalDate date, ZoneId zone) {
        Location location = new Location(DEFAULT_LATITUDE, DEFAULT_LONGITUDE, zone);
        return new PrayerTimesCalculator(location, CalculationConfig.builder().build()).calculate(date);
    }

    /**
     * @param convention    the calculation convention
     * @param dhuhrMinutes  minutes added to solar noon
     * @param asrFactor     standard or Hanafi shadow length
     * @param highLatMethod fallback for Fajr, Maghrib and Isha if the sun does not reach their angles
     * @param latitude      degrees, north positive
     * @param longitude     degrees, east positive
     * @param date          the calendar date in the given time zone
     * @param timeZoneId    a time zone identifier, e.g. {@code Australia/Sydney}
     * @param tuning        minute offsets per {@link Prayer}
     * @throws at.sv.prayer.config.InvalidCalculationConfig if the time zone is invalid or a parameter is missing
     */
    public static PrayerTimes computeCustom(Convention convention, int dhuhrMinutes, AsrFactor asrFactor,
                                           HighLatitudeMethod highLatMethod, double latitude, double longitude,
                                           LocalDate date, String timeZoneId, TuningOffsets tuning) {
        CalculationConfig config = CalculationConfig.builder()
                                                    .convention(convention)
                                                    .dhuhrMinutes(dhuhrMinutes)
                                                    .asrFactor(asrFactor)
                                                    .highLatitudeMethod(highLatMethod)
                                                    .tuning(tuning)
                                                    .build();
        return new PrayerTimesCalculator(Location.of(latitude, longitude, timeZoneId), config).calculate(date);
    }
}
