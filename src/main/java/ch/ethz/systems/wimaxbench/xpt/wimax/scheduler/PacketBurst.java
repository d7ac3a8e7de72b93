package ch.ethz.systems.wimaxbench.xpt.wimax.scheduler;

import ch.ethz.systems.wimaxbench.xpt.wimax.mac.MacPacket;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, append-only sequence of MAC packets transmitted in one uplink opportunity.
 */
public class PacketBurst {

    public static final int NO_CID = -1;

    private final int cid;
    private final List<MacPacket> packets;

    /**
     * @param cid   Connection the burst is assembled from, or {@link #NO_CID}
     */
    public PacketBurst(int cid) {
        this.cid = cid;
        this.packets = new ArrayList<>();
    }

    void addPacket(MacPacket packet) {
        packets.add(packet);
    }

    public List<MacPacket> getPackets() {
        return Collections.unmodifiableList(packets);
    }

    public int getNrPackets() {
        return packets.size();
    }

    public boolean isEmpty() {
        return packets.isEmpty();
    }

    /**
     * Connection the burst was assembled from.
     *
     * @return  CID, or {@link #NO_CID} if no connection was selected
     */
    public int getCid() {
        return cid;
    }

    public long getSizeBytes() {
        long size = 0;
        for (MacPacket packet : packets) {
            size += packet.getSizeBytes();
        }
        return size;
    }

    @Override
    public String toString() {
        return "PacketBurst[cid=" + cid + ", packets=" + packets.size() + ", size=" + getSizeBytes() + "B]";
    }

}
