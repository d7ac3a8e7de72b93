package ch.ethz.systems.wimaxbench.xpt.wimax.phy;

/**
 * Modulation and coding schemes of the OFDM PHY (256-point FFT, 192 data subcarriers).
 * Each scheme carries a fixed number of data bytes per OFDM symbol.
 */
public enum ModulationType {

    BPSK_12(12),
    QPSK_12(24),
    QPSK_34(36),
    QAM16_12(48),
    QAM16_34(72),
    QAM64_23(96),
    QAM64_34(108);

    private final int bytesPerSymbol;

    ModulationType(int bytesPerSymbol) {
        this.bytesPerSymbol = bytesPerSymbol;
    }

    public int getBytesPerSymbol() {
        return bytesPerSymbol;
    }

    /**
     * Parse a modulation from its configuration name (case-insensitive, e.g. "qam16_34").
     *
     * @param name  Modulation name
     *
     * @return  Modulation type
     */
    public static ModulationType fromName(String name) {
        for (ModulationType type : values()) {
            if (type.name().equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown modulation type: " + name);
    }

}
