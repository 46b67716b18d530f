package at.sv.prayer;

/**
 * The calculated times of a day, in output order.
 */
public enum Prayer {
    IMSAK(5),
    FAJR(5),
    SUNRISE(6),
    DHUHR(12),
    ASR(13),
    SUNSET(18),
    MAGHRIB(18),
    ISHA(18),
    MIDNIGHT(18);

    private final double seedHour;

    Prayer(double seedHour) {
        this.seedHour = seedHour;
    }

    /**
     * @return the approximate time of the event, as a fraction of the day, used as the starting point for the
     * solar position
     */
    public double getDayPortion() {
        return seedHour / 24.0;
    }

    public String getDisplayName() {
        String name = name();
        return name.charAt(0) + name.substring(1).toLowerCase(java.util.Locale.ROOT);
    }
}
