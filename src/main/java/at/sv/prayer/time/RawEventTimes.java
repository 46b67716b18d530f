package at.sv.prayer.time;

import at.sv.prayer.Prayer;

import java.util.EnumSet;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Working buffer of one calculation: the fractional hours of each {@link Prayer}, or unresolved if the sun does not
 * reach the required position on that day. Not thread-safe.
 */
final class RawEventTimes {

    private final double[] hours = new double[Prayer.values().length];
    private final boolean[] resolved = new boolean[Prayer.values().length];

    boolean isResolved(Prayer prayer) {
        return resolved[prayer.ordinal()];
    }

    /**
     * @throws IllegalStateException if the time is unresolved
     */
    double get(Prayer prayer) {
        if (!isResolved(prayer)) {
            throw new IllegalStateException(prayer + " is unresolved");
        }
        return hours[prayer.ordinal()];
    }

    OptionalDouble find(Prayer prayer) {
        return isResolved(prayer) ? OptionalDouble.of(hours[prayer.ordinal()]) : OptionalDouble.empty();
    }

    void set(Prayer prayer, double value) {
        hours[prayer.ordinal()] = value;
        resolved[prayer.ordinal()] = true;
    }

    void set(Prayer prayer, OptionalDouble value) {
        if (value.isPresent()) {
            set(prayer, value.getAsDouble());
        } else {
            clear(prayer);
        }
    }

    void clear(Prayer prayer) {
        hours[prayer.ordinal()] = 0;
        resolved[prayer.ordinal()] = false;
    }

    /**
     * Adds the given hours to the time, if resolved.
     */
    void shift(Prayer prayer, double deltaHours) {
        if (isResolved(prayer)) {
            hours[prayer.ordinal()] += deltaHours;
        }
    }

    void shiftAll(double deltaHours) {
        for (Prayer prayer : Prayer.values()) {
            shift(prayer, deltaHours);
        }
    }

    Set<Prayer> getUnresolved() {
        EnumSet<Prayer> unresolved = EnumSet.noneOf(Prayer.class);
        for (Prayer prayer : Prayer.values()) {
            if (!isResolved(prayer)) {
                unresolved.add(prayer);
            }
        }
        return unresolved;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Prayer prayer : Prayer.values()) {
            if (prayer.ordinal() > 0) {
                sb.append(", ");
            }
            sb.append(prayer.getDisplayName()).append('=');
            sb.append(isResolved(prayer) ? String.format(java.util.Locale.ROOT, "%.4f", get(prayer)) : "-");
        }
        return sb.append('}').toString();
    }
}
