package at.sv.prayer.astro;

import java.util.OptionalDouble;

import static at.sv.prayer.math.DegreeMath.arccos;
import static at.sv.prayer.math.DegreeMath.arccot;
import static at.sv.prayer.math.DegreeMath.cos;
import static at.sv.prayer.math.DegreeMath.fixHour;
import static at.sv.prayer.math.DegreeMath.sin;
import static at.sv.prayer.math.DegreeMath.tan;

/**
 * Solves for the local apparent solar time at which the sun reaches a given position.
 * <p>
 * Angles are measured below the horizon. Values greater than 90 select the morning side of solar noon,
 * i.e. {@code 180 - angle} is used for dawn events.
 * All times are in hours and relative to the julian day passed in, which already has to contain the longitude
 * correction.
 */
public final class EventTimeSolver {

    /**
     * Refraction plus the apparent radius of the sun.
     */
    public static final double HORIZON_ANGLE = 0.833;

    private EventTimeSolver() {
    }

    /**
     * @param dayPortion the approximate time of the event as fraction of the day
     * @return solar noon in hours [0, 24)
     */
    public static double midday(double dayPortion, double julianDay) {
        double equationOfTime = SolarPosition.at(julianDay + dayPortion).equationOfTime();
        return fixHour(12 - equationOfTime);
    }

    /**
     * @param angle      the angle of the sun below the horizon in degrees, greater than 90 for morning events
     * @param dayPortion the approximate time of the event as fraction of the day
     * @param julianDay  the julian day of the calculation
     * @param latitude   the latitude in degrees
     * @return the time in hours, or empty if the sun never reaches the angle on this day
     */
    public static OptionalDouble timeForAngle(double angle, double dayPortion, double julianDay, double latitude) {
        double cosHourAngle = cosHourAngle(angle, dayPortion, julianDay, latitude);
        if (!(Math.abs(cosHourAngle) <= 1.0)) { // also rejects NaN
            return OptionalDouble.empty();
        }
        double noon = midday(dayPortion, julianDay);
        double hourAngle = arccos(cosHourAngle) / 15.0;
        if (angle > 90) {
            return OptionalDouble.of(noon - hourAngle);
        }
        return OptionalDouble.of(noon + hourAngle);
    }

    /**
     * @param angle an evening angle below the horizon in degrees, e.g. {@link #HORIZON_ANGLE} for sunset
     * @return true if the sun does not go down to the given angle on this day, i.e. it stays above it even at
     * solar midnight
     */
    public static boolean staysAbove(double angle, double dayPortion, double julianDay, double latitude) {
        return cosHourAngle(angle, dayPortion, julianDay, latitude) < -1.0;
    }

    private static double cosHourAngle(double angle, double dayPortion, double julianDay, double latitude) {
        double declination = SolarPosition.at(julianDay + dayPortion).declination();
        return (-sin(angle) - sin(declination) * sin(latitude)) / (cos(declination) * cos(latitude));
    }

    /**
     * Asr starts when the shadow of an object is {@code shadowFactor} times its length plus its shadow at noon.
     *
     * @param shadowFactor 1 for the standard, 2 for the Hanafi definition
     */
    public static OptionalDouble timeForAsr(double shadowFactor, double dayPortion, double julianDay, double latitude) {
        double declination = SolarPosition.at(julianDay + dayPortion).declination();
        double angle = -arccot(shadowFactor + tan(Math.abs(latitude - declination)));
        return timeForAngle(angle, dayPortion, julianDay, latitude);
    }
}
