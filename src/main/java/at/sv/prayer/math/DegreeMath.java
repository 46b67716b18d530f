package at.sv.prayer.math;

/**
 * Trigonometric helpers working in degrees, and range reduction for angles and hours.
 */
public final class DegreeMath {

    private DegreeMath() {
    }

    /**
     * @return the given angle reduced to [0, 360)
     */
    public static double fixAngle(double angle) {
        return fix(angle, 360.0);
    }

    /**
     * @return the given hour value reduced to [0, 24)
     */
    public static double fixHour(double hours) {
        return fix(hours, 24.0);
    }

    private static double fix(double value, double range) {
        double result = value - range * Math.floor(value / range);
        if (result < 0) {
            result += range;
        }
        if (result >= range) { // floating point carry, e.g. for -1e-18
            result -= range;
        }
        return result;
    }

    /**
     * Returns the positive duration in hours from {@code from} to {@code to}, wrapping around midnight.
     */
    public static double timeDiff(double from, double to) {
        return fixHour(to - from);
    }

    public static double degreesToRadians(double degrees) {
        return degrees * Math.PI / 180.0;
    }

    public static double radiansToDegrees(double radians) {
        return radians * 180.0 / Math.PI;
    }

    public static double sin(double degrees) {
        return Math.sin(degreesToRadians(degrees));
    }

    public static double cos(double degrees) {
        return Math.cos(degreesToRadians(degrees));
    }

    public static double tan(double degrees) {
        return Math.tan(degreesToRadians(degrees));
    }

    public static double arcsin(double x) {
        return radiansToDegrees(Math.asin(x));
    }

    /**
     * Callers have to make sure that {@code |x| <= 1}, otherwise the result is NaN.
     */
    public static double arccos(double x) {
        return radiansToDegrees(Math.acos(x));
    }

    public static double arctan(double x) {
        return radiansToDegrees(Math.atan(x));
    }

    public static double arctan2(double y, double x) {
        return radiansToDegrees(Math.atan2(y, x));
    }

    public static double arccot(double x) {
        return radiansToDegrees(Math.atan2(1.0, x));
    }
}
