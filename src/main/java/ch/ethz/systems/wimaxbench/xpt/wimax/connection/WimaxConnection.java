package ch.ethz.systems.wimaxbench.xpt.wimax.connection;

import ch.ethz.systems.wimaxbench.xpt.wimax.mac.MacHeaderType;
import ch.ethz.systems.wimaxbench.xpt.wimax.mac.MacPacket;
import ch.ethz.systems.wimaxbench.xpt.wimax.mac.WimaxMacQueue;

/**
 * A MAC connection of the subscriber station, identified by its CID.
 * Owns the queue of packets pending for the uplink.
 */
public class WimaxConnection {

    private final int cid;
    private final ConnectionType type;
    private final WimaxMacQueue queue;

    /**
     * Constructor.
     *
     * @param cid       Connection identifier
     * @param type      Connection class
     * @param queue     Queue of pending packets (owned by this connection)
     */
    public WimaxConnection(int cid, ConnectionType type, WimaxMacQueue queue) {
        this.cid = cid;
        this.type = type;
        this.queue = queue;
    }

    public int getCid() {
        return cid;
    }

    public ConnectionType getType() {
        return type;
    }

    public WimaxMacQueue getQueue() {
        return queue;
    }

    /**
     * Enqueue a packet for transmission on this connection.
     *
     * @param packet    MAC packet
     *
     * @return  True iff enqueued, false if the queue dropped it
     */
    public boolean enqueue(MacPacket packet) {
        if (packet.getCid() != cid) {
            throw new IllegalArgumentException("Packet for CID " + packet.getCid() + " enqueued on connection " + cid);
        }
        return queue.enqueue(packet);
    }

    public boolean hasPackets() {
        return !queue.isEmpty();
    }

    public boolean hasPackets(MacHeaderType packetType) {
        return !queue.isEmpty(packetType);
    }

    public MacPacket dequeue(MacHeaderType packetType) {
        return queue.dequeue(packetType);
    }

    public MacPacket dequeue(MacHeaderType packetType, int availableBytes) {
        return queue.dequeue(packetType, availableBytes);
    }

    public int getFirstPacketRequiredByte(MacHeaderType packetType) {
        return queue.getFirstPacketRequiredByte(packetType);
    }

    public int getFirstPacketHdrSize(MacHeaderType packetType) {
        return queue.getFirstPacketHdrSize(packetType);
    }

    public boolean checkForFragmentation(MacHeaderType packetType) {
        return queue.checkForFragmentation(packetType);
    }

    @Override
    public String toString() {
        return "WimaxConnection[cid=" + cid + ", type=" + type + ", queued=" + queue.getSize() + "]";
    }

}
