package at.sv.prayer.config;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * The parameters of a calculation that do not depend on the location.
 */
@Builder(toBuilder = true)
@Getter
@EqualsAndHashCode
public final class CalculationConfig {

    public static final int DEFAULT_IMSAK_MINUTES = 10;

    @Builder.Default
    private final Convention convention = Convention.JAFARI;
    @Builder.Default
    private final AsrFactor asrFactor = AsrFactor.STANDARD;
    @Builder.Default
    private final HighLatitudeMethod highLatitudeMethod = HighLatitudeMethod.ANGLE_BASED;
    /**
     * Minutes added to the solar noon.
     */
    private final int dhuhrMinutes;
    /**
     * Minutes Imsak lies before Fajr.
     */
    @Builder.Default
    private final int imsakMinutes = DEFAULT_IMSAK_MINUTES;
    @Builder.Default
    private final TuningOffsets tuning = TuningOffsets.none();
    /**
     * Angles used instead of the table values if the convention is {@link Convention#CUSTOM}.
     */
    private final ConventionAngles customAngles;

    /**
     * @throws InvalidCalculationConfig if a required parameter is missing
     */
    public CalculationConfig validate() {
        requireNonNull(convention, "convention");
        requireNonNull(asrFactor, "asrFactor");
        requireNonNull(highLatitudeMethod, "highLatitudeMethod");
        requireNonNull(tuning, "tuning");
        return this;
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new InvalidCalculationConfig("Missing calculation parameter '" + name + "'");
        }
    }

    /**
     * @return the angles of the configured convention, or the custom angles for {@link Convention#CUSTOM} if given
     */
    public ConventionAngles getAngles() {
        if (convention == Convention.CUSTOM && customAngles != null) {
            return customAngles;
        }
        return convention.getAngles();
    }

    @Override
    public String toString() {
        return "(convention=" + convention +
               ", asr=" + asrFactor +
               ", highLat=" + highLatitudeMethod +
               (dhuhrMinutes != 0 ? ", dhuhr=" + dhuhrMinutes : "") +
               ", imsak=" + imsakMinutes +
               ", tuning=" + tuning +
               (customAngles != null ? ", customAngles=" + customAngles : "") +
               ")";
    }
}
