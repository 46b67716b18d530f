package at.sv.prayer.config;

/**
 * Signals a programming error in the calculation parameters, e.g. an unknown time zone or convention index.
 * Calculations fail fast with this exception instead of producing wrong times.
 */
public final class InvalidCalculationConfig extends RuntimeException {

    public InvalidCalculationConfig(String message) {
        super(message);
    }

    public InvalidCalculationConfig(String message, Throwable cause) {
        super(message, cause);
    }
}
