package ch.ethz.systems.wimaxbench.core.network;

/**
 * Unit of data which travels through the simulated network.
 */
public abstract class Packet {

    private final long flowId;
    private final long sizeBit;

    /**
     * Construct a packet.
     *
     * @param flowId    Identifier of the flow the packet belongs to
     * @param sizeBit   Total size of the packet in bits
     */
    public Packet(long flowId, long sizeBit) {
        this.flowId = flowId;
        this.sizeBit = sizeBit;
    }

    public long getFlowId() {
        return flowId;
    }

    public long getSizeBit() {
        return sizeBit;
    }

    @Override
    public String toString() {
        return "Packet[flow=" + flowId + ", size=" + sizeBit + "b]";
    }

}
