package ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow;

/**
 * A service flow: a QoS contract bound to one transport connection.
 *
 * The connection is referred to by its CID, resolved through the
 * {@link ch.ethz.systems.wimaxbench.xpt.wimax.connection.ConnectionManager}.
 *
 * UGS and rtPS flows carry a deadline: the simulation time at which their next
 * unsolicited grant (UGS) or unsolicited poll (rtPS) is due. The first deadline
 * lies one interval after time zero; each time the flow is served, the deadline
 * moves to one interval after the serving time.
 */
public class ServiceFlow {

    private static final long NS_PER_MS = 1_000_000L;

    private final int sfid;
    private final int cid;
    private final SchedulingType schedulingType;
    private final long unsolicitedGrantIntervalMs;
    private final long unsolicitedPollingIntervalMs;

    private long nextDeadlineNs;

    /**
     * Constructor.
     *
     * @param sfid                          Service flow identifier
     * @param cid                           CID of the transport connection of the flow
     * @param schedulingType                QoS scheduling service
     * @param unsolicitedGrantIntervalMs    Grant interval in milliseconds (UGS only)
     * @param unsolicitedPollingIntervalMs  Polling interval in milliseconds (rtPS only)
     */
    public ServiceFlow(int sfid, int cid, SchedulingType schedulingType,
                       long unsolicitedGrantIntervalMs, long unsolicitedPollingIntervalMs) {
        if (unsolicitedGrantIntervalMs < 0 || unsolicitedPollingIntervalMs < 0) {
            throw new IllegalArgumentException("Grant and polling intervals cannot be negative");
        }
        this.sfid = sfid;
        this.cid = cid;
        this.schedulingType = schedulingType;
        this.unsolicitedGrantIntervalMs = unsolicitedGrantIntervalMs;
        this.unsolicitedPollingIntervalMs = unsolicitedPollingIntervalMs;
        this.nextDeadlineNs = getIntervalNs();
    }

    /**
     * Interval between two grants (UGS) or polls (rtPS); zero for the other services.
     *
     * @return  Interval in nanoseconds
     */
    public long getIntervalNs() {
        switch (schedulingType) {
            case UGS:
                return unsolicitedGrantIntervalMs * NS_PER_MS;
            case RTPS:
                return unsolicitedPollingIntervalMs * NS_PER_MS;
            default:
                return 0;
        }
    }

    /**
     * Check whether the flow is due for service in the frame starting now:
     * its deadline falls before the end of the frame. nrtPS and BE flows are always due.
     *
     * @param nowNs             Current simulation time
     * @param frameDurationNs   Duration of one frame
     *
     * @return  True iff the flow may be served now
     */
    public boolean isDue(long nowNs, long frameDurationNs) {
        switch (schedulingType) {
            case UGS:
            case RTPS:
                return nowNs + frameDurationNs > nextDeadlineNs;
            default:
                return true;
        }
    }

    /**
     * Record that the flow was served at the given time, moving its deadline
     * one interval ahead. Has no effect for nrtPS and BE flows.
     *
     * @param nowNs     Simulation time of service
     */
    public void markServed(long nowNs) {
        if (schedulingType == SchedulingType.UGS || schedulingType == SchedulingType.RTPS) {
            nextDeadlineNs = nowNs + getIntervalNs();
        }
    }

    public int getSfid() {
        return sfid;
    }

    public int getCid() {
        return cid;
    }

    public SchedulingType getSchedulingType() {
        return schedulingType;
    }

    public long getUnsolicitedGrantIntervalMs() {
        return unsolicitedGrantIntervalMs;
    }

    public long getUnsolicitedPollingIntervalMs() {
        return unsolicitedPollingIntervalMs;
    }

    public long getNextDeadlineNs() {
        return nextDeadlineNs;
    }

    @Override
    public String toString() {
        return "ServiceFlow[sfid=" + sfid + ", cid=" + cid + ", type=" + schedulingType + "]";
    }

}
