package at.sv.prayer.config;

/**
 * @param fajrAngle angle of the sun below the horizon at Fajr, in degrees
 * @param maghrib   definition of Maghrib, minutes are relative to sunset
 * @param isha      definition of Isha, minutes are relative to Maghrib
 */
public record ConventionAngles(double fajrAngle, EveningDefinition maghrib, EveningDefinition isha) {

    public ConventionAngles {
        if (maghrib == null || isha == null) {
            throw new InvalidCalculationConfig("Maghrib and Isha definitions are required");
        }
    }
}
