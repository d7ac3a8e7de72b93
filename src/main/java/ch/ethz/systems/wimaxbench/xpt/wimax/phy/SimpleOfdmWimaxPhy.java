package ch.ethz.systems.wimaxbench.xpt.wimax.phy;

/**
 * OFDM PHY with a fixed number of data bytes per symbol for each modulation.
 * Symbol counts are rounded up, byte counts are exact multiples of the symbol capacity.
 */
public class SimpleOfdmWimaxPhy implements IWimaxPhy {

    public static final long DEFAULT_FRAME_DURATION_NS = 10_000_000L;

    private final long frameDurationNs;

    public SimpleOfdmWimaxPhy() {
        this(DEFAULT_FRAME_DURATION_NS);
    }

    /**
     * @param frameDurationNs   Duration of one MAC frame in nanoseconds
     */
    public SimpleOfdmWimaxPhy(long frameDurationNs) {
        if (frameDurationNs <= 0) {
            throw new IllegalArgumentException("Frame duration must be positive: " + frameDurationNs);
        }
        this.frameDurationNs = frameDurationNs;
    }

    @Override
    public int getNrBytes(int symbols, ModulationType modulationType) {
        if (symbols < 0) {
            throw new IllegalArgumentException("Number of symbols cannot be negative: " + symbols);
        }
        // Capped at the largest int byte count
        long bytes = (long) symbols * modulationType.getBytesPerSymbol();
        return (int) Math.min(bytes, Integer.MAX_VALUE);
    }

    @Override
    public int getNrSymbols(int bytes, ModulationType modulationType) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Number of bytes cannot be negative: " + bytes);
        }
        long bytesPerSymbol = modulationType.getBytesPerSymbol();
        return (int) ((bytes + bytesPerSymbol - 1) / bytesPerSymbol);
    }

    @Override
    public long getFrameDurationNs() {
        return frameDurationNs;
    }

}
