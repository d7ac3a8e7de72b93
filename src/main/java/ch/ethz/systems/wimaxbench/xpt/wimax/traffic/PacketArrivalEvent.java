package ch.ethz.systems.wimaxbench.xpt.wimax.traffic;

import ch.ethz.systems.wimaxbench.core.network.Event;
import ch.ethz.systems.wimaxbench.xpt.wimax.station.SubscriberStation;

/**
 * Arrival of an upper-layer packet at a connection of a subscriber station.
 */
public class PacketArrivalEvent extends Event {

    private final SubscriberStation station;
    private final int cid;
    private final int payloadBytes;

    /**
     * Create event which will happen the given amount of nanoseconds later.
     *
     * @param timeFromNowNs     Time it will take before happening from now in nanoseconds
     * @param station           Station at which the packet arrives
     * @param cid               Connection the packet is enqueued on
     * @param payloadBytes      Payload size in bytes
     */
    public PacketArrivalEvent(long timeFromNowNs, SubscriberStation station, int cid, int payloadBytes) {
        super(timeFromNowNs);
        this.station = station;
        this.cid = cid;
        this.payloadBytes = payloadBytes;
    }

    public int getCid() {
        return cid;
    }

    public int getPayloadBytes() {
        return payloadBytes;
    }

    @Override
    public void trigger() {
        station.enqueueData(cid, payloadBytes);
    }

}
