package at.sv.prayer.time;

import at.sv.prayer.Prayer;
import at.sv.prayer.config.CalculationConfig;
import at.sv.prayer.config.Location;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.function.Supplier;

public final class PrayerTimesProviderImpl implements PrayerTimesProvider {

    private final Location location;
    private final Supplier<ZonedDateTime> currentTime;
    private final PrayerTimesCalculator calculator;

    public PrayerTimesProviderImpl(Location location, CalculationConfig config) {
        this(() -> ZonedDateTime.now(location.zone()), location, config);
    }

    public PrayerTimesProviderImpl(Supplier<ZonedDateTime> currentTime, Location location, CalculationConfig config) {
        this.location = location;
        this.currentTime = currentTime;
        this.calculator = new PrayerTimesCalculator(location, config);
    }

    @Override
    public PrayerTimes getPrayerTimes(LocalDate date) {
        return calculator.calculate(date);
    }

    /**
     * @return the times for the current date in the time zone of the location
     */
    public PrayerTimes getToday() {
        return getPrayerTimes(currentTime.get().withZoneSameInstant(location.zone()));
    }

    @Override
    public String toDebugString(LocalDate date) {
        PrayerTimes times = getPrayerTimes(date);
        StringBuilder sb = new StringBuilder();
        for (Prayer prayer : Prayer.values()) {
            sb.append('\n').append(prayer.name().toLowerCase(Locale.ENGLISH)).append(": ")
              .append(times.isResolved(prayer) ? times.get(prayer) : "unresolved");
        }
        return sb.toString();
    }
}
