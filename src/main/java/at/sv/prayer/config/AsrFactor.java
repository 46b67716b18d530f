package at.sv.prayer.config;

public enum AsrFactor {
    /**
     * Shafii, Maliki, Jafari and Hanbali
     */
    STANDARD(1),
    HANAFI(2);

    private final int shadowFactor;

    AsrFactor(int shadowFactor) {
        this.shadowFactor = shadowFactor;
    }

    public int getShadowFactor() {
        return shadowFactor;
    }

    public static AsrFactor fromShadowFactor(int shadowFactor) {
        for (AsrFactor factor : values()) {
            if (factor.shadowFactor == shadowFactor) {
                return factor;
            }
        }
        throw new InvalidCalculationConfig("Unsupported asr shadow factor " + shadowFactor + ", expected 1 or 2");
    }
}
