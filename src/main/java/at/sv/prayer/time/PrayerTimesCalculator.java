package at.sv.prayer.time;

import at.sv.prayer.Prayer;
import at.sv.prayer.astro.EventTimeSolver;
import at.sv.prayer.astro.JulianDay;
import at.sv.prayer.config.CalculationConfig;
import at.sv.prayer.config.ConventionAngles;
import at.sv.prayer.config.EveningDefinition;
import at.sv.prayer.config.HighLatitudeMethod;
import at.sv.prayer.config.Location;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Set;

import static at.sv.prayer.astro.EventTimeSolver.HORIZON_ANGLE;
import static at.sv.prayer.math.DegreeMath.timeDiff;

/**
 * Calculates the prayer times of a single day. Stateless, instances can be shared between threads.
 */
public final class PrayerTimesCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(PrayerTimesCalculator.class);

    private final Location location;
    private final CalculationConfig config;
    private final ConventionAngles angles;
    private final HighLatitudeAdjuster highLatitudeAdjuster;

    public PrayerTimesCalculator(Location location, CalculationConfig config) {
        this.location = location;
        this.config = config.validate();
        this.angles = config.getAngles();
        this.highLatitudeAdjuster = new HighLatitudeAdjuster(config.getHighLatitudeMethod(), angles);
    }

    public PrayerTimes calculate(LocalDate date) {
        double offsetHours = location.offsetHoursOn(date);
        double julianDay = JulianDay.of(date) - location.longitude() / (15.0 * 24.0);
        RawEventTimes times = computeRawTimes(julianDay);
        LOG.debug("Raw solar times for {} at {}: {}", date, location, times);

        times.shiftAll(offsetHours - location.longitude() / 15.0);
        highLatitudeAdjuster.adjust(times, sunNeverSets(times, julianDay));
        applyConventionOffsets(times);
        computeMidnight(times);
        applyTuning(times);
        LOG.debug("Adjusted times for {} (offset {}h, {}): {}", date, offsetHours, config, times);

        Set<Prayer> unresolved = times.getUnresolved();
        if (!unresolved.isEmpty()) {
            logUnresolved(date, unresolved);
        }
        return PrayerTimes.of(times);
    }

    private RawEventTimes computeRawTimes(double julianDay) {
        double latitude = location.latitude();

        RawEventTimes times = new RawEventTimes();
        times.set(Prayer.FAJR, EventTimeSolver.timeForAngle(180 - angles.fajrAngle(),
                Prayer.FAJR.getDayPortion(), julianDay, latitude));
        times.set(Prayer.SUNRISE, EventTimeSolver.timeForAngle(180 - HORIZON_ANGLE,
                Prayer.SUNRISE.getDayPortion(), julianDay, latitude));
        double midday = EventTimeSolver.midday(Prayer.DHUHR.getDayPortion(), julianDay);
        if (Double.isFinite(midday)) {
            times.set(Prayer.DHUHR, midday);
        } else {
            times.clear(Prayer.DHUHR);
        }
        times.set(Prayer.ASR, EventTimeSolver.timeForAsr(config.getAsrFactor().getShadowFactor(),
                Prayer.ASR.getDayPortion(), julianDay, latitude));
        times.set(Prayer.SUNSET, EventTimeSolver.timeForAngle(HORIZON_ANGLE,
                Prayer.SUNSET.getDayPortion(), julianDay, latitude));
        if (angles.maghrib().isAngle()) {
            times.set(Prayer.MAGHRIB, EventTimeSolver.timeForAngle(angles.maghrib().value(),
                    Prayer.MAGHRIB.getDayPortion(), julianDay, latitude));
        }
        if (angles.isha().isAngle()) {
            times.set(Prayer.ISHA, EventTimeSolver.timeForAngle(angles.isha().value(),
                    Prayer.ISHA.getDayPortion(), julianDay, latitude));
        }
        return times;
    }

    private boolean sunNeverSets(RawEventTimes times, double julianDay) {
        return !times.isResolved(Prayer.SUNSET)
               && EventTimeSolver.staysAbove(HORIZON_ANGLE, Prayer.SUNSET.getDayPortion(), julianDay,
                location.latitude());
    }

    private void applyConventionOffsets(RawEventTimes times) {
        deriveFrom(times, Prayer.IMSAK, Prayer.FAJR, -config.getImsakMinutes());
        times.shift(Prayer.DHUHR, config.getDhuhrMinutes() / 60.0);
        deriveIfMinutesAfter(times, Prayer.MAGHRIB, angles.maghrib(), Prayer.SUNSET);
        deriveIfMinutesAfter(times, Prayer.ISHA, angles.isha(), Prayer.MAGHRIB);
    }

    private static void deriveIfMinutesAfter(RawEventTimes times, Prayer prayer, EveningDefinition definition,
                                             Prayer reference) {
        if (definition.isMinutesAfter()) {
            deriveFrom(times, prayer, reference, definition.value());
        }
    }

    private static void deriveFrom(RawEventTimes times, Prayer prayer, Prayer reference, double minutes) {
        if (times.isResolved(reference)) {
            times.set(prayer, times.get(reference) + minutes / 60.0);
        } else {
            times.clear(prayer);
        }
    }

    private void computeMidnight(RawEventTimes times) {
        Prayer end = config.getConvention().isMidnightUntilFajr() ? Prayer.FAJR : Prayer.SUNRISE;
        if (times.isResolved(Prayer.SUNSET) && times.isResolved(end)) {
            double sunset = times.get(Prayer.SUNSET);
            times.set(Prayer.MIDNIGHT, sunset + timeDiff(sunset, times.get(end)) / 2.0);
        } else {
            times.clear(Prayer.MIDNIGHT);
        }
    }

    private void applyTuning(RawEventTimes times) {
        for (Prayer prayer : Prayer.values()) {
            times.shift(prayer, config.getTuning().getMinutes(prayer) / 60.0);
        }
    }

    private void logUnresolved(LocalDate date, Set<Prayer> unresolved) {
        if (config.getHighLatitudeMethod() == HighLatitudeMethod.NONE) {
            LOG.warn("Sun does not reach the required position for {} on {} at {}. " +
                     "Consider a high latitude method other than {}.", unresolved, date, location,
                    HighLatitudeMethod.NONE);
        } else {
            LOG.warn("Sun does not reach the required position for {} on {} at {}, even with {} adjustment.",
                    unresolved, date, location, config.getHighLatitudeMethod());
        }
    }
}
