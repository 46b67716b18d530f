package at.sv.prayer.time;

import at.sv.prayer.Prayer;
import at.sv.prayer.config.ConventionAngles;
import at.sv.prayer.config.EveningDefinition;
import at.sv.prayer.config.HighLatitudeMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import static at.sv.prayer.math.DegreeMath.timeDiff;

/**
 * Replaces Fajr, and angle based Maghrib and Isha, if they are unresolved or lie further away from sunrise or sunset
 * than the portion of the night allowed by the {@link HighLatitudeMethod}.
 * Minute based definitions are left alone, they are derived from their reference event afterwards.
 * Nothing is adjusted during polar night, or if sunrise or sunset is missing for any other reason than midnight sun.
 */
@Slf4j
@RequiredArgsConstructor
final class HighLatitudeAdjuster {

    private final HighLatitudeMethod method;
    private final ConventionAngles angles;

    /**
     * @param sunNeverSets true on days of midnight sun. The night then has no length and Fajr, Maghrib and Isha are
     *                     placed at solar midnight, twelve hours after Dhuhr.
     */
    void adjust(RawEventTimes times, boolean sunNeverSets) {
        if (method == HighLatitudeMethod.NONE) {
            return;
        }
        if (times.isResolved(Prayer.SUNRISE) && times.isResolved(Prayer.SUNSET)) {
            double sunrise = times.get(Prayer.SUNRISE);
            double sunset = times.get(Prayer.SUNSET);
            adjustAll(times, sunrise, sunset, timeDiff(sunset, sunrise));
        } else if (sunNeverSets && times.isResolved(Prayer.DHUHR)) {
            double solarMidnight = times.get(Prayer.DHUHR) + 12;
            log.debug("Sun does not set: Adjust around solar midnight {}", solarMidnight);
            adjustAll(times, solarMidnight, solarMidnight, 0);
        } else {
            log.debug("No sunrise or sunset, night length undefined: Skip high latitude adjustment");
        }
    }

    private void adjustAll(RawEventTimes times, double sunrise, double sunset, double nightLength) {
        adjustFajr(times, sunrise, nightLength);
        adjustEvening(times, Prayer.MAGHRIB, angles.maghrib(), sunset, nightLength);
        adjustEvening(times, Prayer.ISHA, angles.isha(), sunset, nightLength);
    }

    private void adjustFajr(RawEventTimes times, double sunrise, double nightLength) {
        double maxDiff = method.nightPortion(angles.fajrAngle()) * nightLength;
        if (!times.isResolved(Prayer.FAJR) || timeDiff(times.get(Prayer.FAJR), sunrise) > maxDiff) {
            replace(times, Prayer.FAJR, sunrise - maxDiff);
        }
    }

    private void adjustEvening(RawEventTimes times, Prayer prayer, EveningDefinition definition, double sunset,
                               double nightLength) {
        if (!definition.isAngle()) {
            return;
        }
        double maxDiff = method.nightPortion(definition.value()) * nightLength;
        if (!times.isResolved(prayer) || timeDiff(sunset, times.get(prayer)) > maxDiff) {
            replace(times, prayer, sunset + maxDiff);
        }
    }

    private void replace(RawEventTimes times, Prayer prayer, double value) {
        log.trace("Adjust {} for high latitude ({}): {} -> {}", prayer, method, times.find(prayer), value);
        times.set(prayer, value);
    }
}
