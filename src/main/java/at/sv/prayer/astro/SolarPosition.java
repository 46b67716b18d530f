package at.sv.prayer.astro;

import static at.sv.prayer.math.DegreeMath.arcsin;
import static at.sv.prayer.math.DegreeMath.arctan2;
import static at.sv.prayer.math.DegreeMath.cos;
import static at.sv.prayer.math.DegreeMath.fixAngle;
import static at.sv.prayer.math.DegreeMath.fixHour;
import static at.sv.prayer.math.DegreeMath.sin;

/**
 * Low precision position of the sun, accurate to about one arc minute within two centuries of 2000.
 * See the <a href="https://aa.usno.navy.mil/faq/sun_approx">U.S. Naval Observatory approximation</a>.
 *
 * @param declination    the declination of the sun in degrees
 * @param equationOfTime apparent minus mean solar time in hours, within (-12, 12]
 */
public record SolarPosition(double declination, double equationOfTime) {

    private static final double J2000 = 2451545.0;

    public static SolarPosition at(double julianDay) {
        double d = julianDay - J2000;
        double meanAnomaly = fixAngle(357.529 + 0.98560028 * d);
        double meanLongitude = fixAngle(280.459 + 0.98564736 * d);
        double eclipticLongitude = fixAngle(meanLongitude + 1.915 * sin(meanAnomaly) + 0.020 * sin(2 * meanAnomaly));
        double obliquity = 23.439 - 0.00000036 * d;

        double declination = arcsin(sin(obliquity) * sin(eclipticLongitude));
        double rightAscension = fixHour(arctan2(cos(obliquity) * sin(eclipticLongitude), cos(eclipticLongitude)) / 15.0);
        return new SolarPosition(declination, wrapHalfDay(meanLongitude / 15.0 - rightAscension));
    }

    // mean longitude and right ascension wrap at different times around the march equinox
    private static double wrapHalfDay(double hours) {
        if (hours > 12) {
            return hours - 24;
        }
        if (hours <= -12) {
            return hours + 24;
        }
        return hours;
    }
}
