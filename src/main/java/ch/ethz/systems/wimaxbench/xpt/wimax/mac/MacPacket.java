package ch.ethz.systems.wimaxbench.xpt.wimax.mac;

import ch.ethz.systems.wimaxbench.core.network.Packet;

/**
 * MAC protocol data unit as transmitted on the uplink.
 *
 * The size of a PDU is its MAC header, plus the fragmentation
 * subheader if it is a fragment, plus the payload it carries.
 */
public class MacPacket extends Packet {

    private final long sequenceNumber;
    private final int cid;
    private final MacHeaderType headerType;
    private final int payloadBytes;
    private final FragmentState fragmentState;
    private final int fragmentNumber;
    private final int bandwidthRequestBytes;

    private MacPacket(long flowId, long sequenceNumber, int cid, MacHeaderType headerType, int payloadBytes,
                      FragmentState fragmentState, int fragmentNumber, int bandwidthRequestBytes) {
        super(flowId, 8L * sizeBytes(headerType, payloadBytes, fragmentState));
        if (payloadBytes < 0) {
            throw new IllegalArgumentException("Payload cannot be negative: " + payloadBytes);
        }
        this.sequenceNumber = sequenceNumber;
        this.cid = cid;
        this.headerType = headerType;
        this.payloadBytes = payloadBytes;
        this.fragmentState = fragmentState;
        this.fragmentNumber = fragmentNumber;
        this.bandwidthRequestBytes = bandwidthRequestBytes;
    }

    private static int sizeBytes(MacHeaderType headerType, int payloadBytes, FragmentState fragmentState) {
        int size = headerType.getHeaderBytes() + payloadBytes;
        if (fragmentState != FragmentState.NONE) {
            size += MacHeaderType.FRAGMENTATION_SUBHEADER_BYTES;
        }
        return size;
    }

    /**
     * Create an unfragmented data PDU.
     *
     * @param flowId            Service flow identifier (SFID), or zero for management traffic
     * @param sequenceNumber    Sequence number of the SDU within its flow
     * @param cid               Connection identifier
     * @param payloadBytes      Payload size in bytes
     *
     * @return  Data PDU with a generic MAC header
     */
    public static MacPacket data(long flowId, long sequenceNumber, int cid, int payloadBytes) {
        return new MacPacket(flowId, sequenceNumber, cid, MacHeaderType.GENERIC, payloadBytes, FragmentState.NONE, 0, 0);
    }

    /**
     * Create a bandwidth request PDU (header only).
     *
     * @param flowId                Service flow identifier (SFID)
     * @param sequenceNumber        Sequence number within its flow
     * @param cid                   Connection identifier
     * @param bandwidthRequestBytes Amount of uplink bandwidth requested in bytes
     *
     * @return  Bandwidth request PDU
     */
    public static MacPacket bandwidthRequest(long flowId, long sequenceNumber, int cid, int bandwidthRequestBytes) {
        return new MacPacket(flowId, sequenceNumber, cid, MacHeaderType.BANDWIDTH, 0, FragmentState.NONE, 0, bandwidthRequestBytes);
    }

    /**
     * Create a fragment of this (unfragmented) PDU.
     *
     * @param payloadBytes      Payload carried by the fragment
     * @param fragmentState     Position of the fragment
     * @param fragmentNumber    Index of the fragment, starting at zero
     *
     * @return  Fragment PDU
     */
    MacPacket fragment(int payloadBytes, FragmentState fragmentState, int fragmentNumber) {
        if (fragmentState == FragmentState.NONE) {
            throw new IllegalArgumentException("A fragment must have a fragment state other than NONE");
        }
        return new MacPacket(getFlowId(), sequenceNumber, cid, headerType, payloadBytes, fragmentState, fragmentNumber, 0);
    }

    public long getSequenceNumber() {
        return sequenceNumber;
    }

    public int getCid() {
        return cid;
    }

    public MacHeaderType getHeaderType() {
        return headerType;
    }

    public int getPayloadBytes() {
        return payloadBytes;
    }

    public FragmentState getFragmentState() {
        return fragmentState;
    }

    public int getFragmentNumber() {
        return fragmentNumber;
    }

    public int getBandwidthRequestBytes() {
        return bandwidthRequestBytes;
    }

    public boolean isFragment() {
        return fragmentState != FragmentState.NONE;
    }

    /**
     * Total size of the PDU on the air.
     *
     * @return  Size in bytes
     */
    public int getSizeBytes() {
        return (int) (getSizeBit() / 8);
    }

    @Override
    public String toString() {
        return "MacPacket[cid=" + cid + ", seq=" + sequenceNumber + ", type=" + headerType
                + ", size=" + getSizeBytes() + "B, fragment=" + fragmentState + "]";
    }

}
