package at.sv.prayer.config;

import at.sv.prayer.Prayer;
import lombok.EqualsAndHashCode;

import java.util.Arrays;

/**
 * Signed minute offsets added to each calculated time, indexed by {@link Prayer}.
 */
@EqualsAndHashCode
public final class TuningOffsets {

    private static final int SIZE = Prayer.values().length;
    private static final TuningOffsets NONE = new TuningOffsets(new double[SIZE]);

    private final double[] minutes;

    private TuningOffsets(double[] minutes) {
        this.minutes = minutes;
    }

    public static TuningOffsets none() {
        return NONE;
    }

    /**
     * @param minutes nine values in the order Imsak, Fajr, Sunrise, Dhuhr, Asr, Sunset, Maghrib, Isha, Midnight
     * @throws InvalidCalculationConfig if not exactly nine values are given
     */
    public static TuningOffsets of(double... minutes) {
        if (minutes == null || minutes.length != SIZE) {
            throw new InvalidCalculationConfig("Expected " + SIZE + " tuning offsets, but got " +
                                               (minutes == null ? "null" : String.valueOf(minutes.length)));
        }
        return new TuningOffsets(minutes.clone());
    }

    public double getMinutes(Prayer prayer) {
        return minutes[prayer.ordinal()];
    }

    public TuningOffsets with(Prayer prayer, double offsetMinutes) {
        double[] copy = minutes.clone();
        copy[prayer.ordinal()] = offsetMinutes;
        return new TuningOffsets(copy);
    }

    @Override
    public String toString() {
        return Arrays.toString(minutes);
    }
}
