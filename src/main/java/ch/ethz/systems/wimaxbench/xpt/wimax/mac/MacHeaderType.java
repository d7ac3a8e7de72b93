package ch.ethz.systems.wimaxbench.xpt.wimax.mac;

/**
 * MAC header types a queued packet can carry.
 */
public enum MacHeaderType {

    /**
     * Generic MAC header: a data PDU carrying payload.
     */
    GENERIC(6),

    /**
     * Bandwidth request header: a header-only PDU asking for uplink bandwidth.
     */
    BANDWIDTH(6);

    /**
     * Size of the fragmentation subheader which precedes the payload of a fragment.
     */
    public static final int FRAGMENTATION_SUBHEADER_BYTES = 2;

    private final int headerBytes;

    MacHeaderType(int headerBytes) {
        this.headerBytes = headerBytes;
    }

    public int getHeaderBytes() {
        return headerBytes;
    }

}
