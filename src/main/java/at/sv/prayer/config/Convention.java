package at.sv.prayer.config;

import static at.sv.prayer.config.EveningDefinition.angle;
import static at.sv.prayer.config.EveningDefinition.minutesAfter;

/**
 * The supported calculation conventions, in the order of their legacy integer identifiers.
 */
public enum Convention {
    /**
     * Shia Ithna Ashari, Leva Research Institute, Qum
     */
    JAFARI(16, angle(4), angle(14)),
    /**
     * University of Islamic Sciences, Karachi
     */
    KARACHI(18, minutesAfter(0), angle(18)),
    /**
     * Islamic Society of North America
     */
    ISNA(15, minutesAfter(0), angle(15)),
    /**
     * Muslim World League
     */
    MWL(18, minutesAfter(0), angle(17)),
    /**
     * Umm al-Qura University, Makkah
     */
    MAKKAH(18.5, minutesAfter(0), minutesAfter(90)),
    /**
     * Egyptian General Authority of Survey
     */
    EGYPT(19.5, minutesAfter(0), angle(17.5)),
    /**
     * Institute of Geophysics, University of Tehran
     */
    TEHRAN(17.7, angle(4.5), angle(14)),
    CUSTOM(18, minutesAfter(0), angle(17));

    private static final Convention[] VALUES = values();

    private final ConventionAngles angles;

    Convention(double fajrAngle, EveningDefinition maghrib, EveningDefinition isha) {
        this.angles = new ConventionAngles(fajrAngle, maghrib, isha);
    }

    public ConventionAngles getAngles() {
        return angles;
    }

    /**
     * Midnight is defined as the middle between sunset and Fajr instead of sunset and sunrise.
     */
    public boolean isMidnightUntilFajr() {
        return this == JAFARI;
    }

    /**
     * @throws InvalidCalculationConfig if the index does not denote a convention
     */
    public static Convention fromIndex(int index) {
        if (index < 0 || index >= VALUES.length) {
            throw new InvalidCalculationConfig("Invalid convention index " + index + ", expected [0.." + (VALUES.length - 1) + "]");
        }
        return VALUES[index];
    }
}
