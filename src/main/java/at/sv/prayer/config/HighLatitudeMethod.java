package at.sv.prayer.config;

/**
 * Fallback for Fajr, Maghrib and Isha in regions where the sun does not reach the configured angles.
 * Each method limits the event to a portion of the night, measured from sunset or sunrise.
 */
public enum HighLatitudeMethod {
    NONE {
        @Override
        public double nightPortion(double angle) {
            return 0;
        }
    },
    NIGHT_MIDDLE {
        @Override
        public double nightPortion(double angle) {
            return 0.5;
        }
    },
    ONE_SEVENTH {
        @Override
        public double nightPortion(double angle) {
            return 1.0 / 7.0;
        }
    },
    ANGLE_BASED {
        @Override
        public double nightPortion(double angle) {
            return angle / 60.0;
        }
    };

    private static final HighLatitudeMethod[] VALUES = values();

    /**
     * @param angle the sun angle of the event in degrees
     * @return the portion of the night [0, 1] the event may lie away from sunset or sunrise
     */
    public abstract double nightPortion(double angle);

    public static HighLatitudeMethod fromIndex(int index) {
        if (index < 0 || index >= VALUES.length) {
            throw new InvalidCalculationConfig("Invalid high latitude method index " + index + ", expected [0.." + (VALUES.length - 1) + "]");
        }
        return VALUES[index];
    }
}
