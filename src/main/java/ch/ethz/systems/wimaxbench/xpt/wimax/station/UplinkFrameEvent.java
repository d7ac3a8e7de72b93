package ch.ethz.systems.wimaxbench.xpt.wimax.station;

import ch.ethz.systems.wimaxbench.core.Simulator;
import ch.ethz.systems.wimaxbench.core.network.Event;

/**
 * Start of a MAC frame: the subscriber station uses its uplink opportunity,
 * after which the event of the next frame is registered.
 */
public class UplinkFrameEvent extends Event {

    private final SubscriberStation station;

    /**
     * Create event which will happen the given amount of nanoseconds later.
     *
     * @param timeFromNowNs     Time it will take before happening from now in nanoseconds
     * @param station           Station which receives the uplink opportunity
     */
    public UplinkFrameEvent(long timeFromNowNs, SubscriberStation station) {
        super(timeFromNowNs);
        this.station = station;
    }

    @Override
    public void trigger() {
        station.onUplinkOpportunity();
        Simulator.registerEvent(new UplinkFrameEvent(station.getPhy().getFrameDurationNs(), station));
    }

}
