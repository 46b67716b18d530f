package at.sv.prayer.config;

/**
 * Defines Maghrib or Isha either by a sun angle below the horizon, or as a fixed number of minutes after a reference
 * event (sunset for Maghrib, Maghrib for Isha).
 */
public record EveningDefinition(Kind kind, double value) {

    public enum Kind {
        ANGLE,
        MINUTES_AFTER
    }

    public EveningDefinition {
        if (kind == null) {
            throw new InvalidCalculationConfig("Evening definition kind must not be null");
        }
    }

    public static EveningDefinition angle(double degrees) {
        return new EveningDefinition(Kind.ANGLE, degrees);
    }

    public static EveningDefinition minutesAfter(double minutes) {
        return new EveningDefinition(Kind.MINUTES_AFTER, minutes);
    }

    public boolean isAngle() {
        return kind == Kind.ANGLE;
    }

    public boolean isMinutesAfter() {
        return kind == Kind.MINUTES_AFTER;
    }

    @Override
    public String toString() {
        return isAngle() ? value + "°" : value + " min";
    }
}
