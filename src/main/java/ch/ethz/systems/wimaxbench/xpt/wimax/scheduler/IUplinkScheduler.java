package ch.ethz.systems.wimaxbench.xpt.wimax.scheduler;

import ch.ethz.systems.wimaxbench.xpt.wimax.connection.WimaxConnection;
import ch.ethz.systems.wimaxbench.xpt.wimax.mac.MacHeaderType;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.ModulationType;

/**
 * Uplink scheduler of a subscriber station: decides which connection uses an
 * uplink opportunity and which of its packets are transmitted in it.
 *
 * Invoked once per uplink grant by the frame logic of the station, always from
 * the simulation thread; every call runs to completion.
 */
public interface IUplinkScheduler {

    // =========================================================================
    // SCHEDULING
    // =========================================================================

    /**
     * Assemble the burst for one uplink opportunity.
     *
     * Dequeues packets of the given type from the connection (FIFO) as long as
     * they fit in the remaining symbols. When the next packet of a transport
     * connection does not fit, a fragment filling the remaining bytes is sent
     * if it can carry payload.
     *
     * @param availableSymbols  Symbols granted for the opportunity
     * @param modulationType    Modulation of the opportunity
     * @param packetType        Type of packets to send (data or bandwidth requests)
     * @param connection        Connection to serve, or null to let the scheduler
     *                          {@link #selectConnection() select} one
     *
     * @return  Assembled burst, possibly empty
     *
     * @throws IllegalStateException if an explicit connection has no packet of the requested type
     */
    PacketBurst schedule(int availableSymbols, ModulationType modulationType,
                         MacHeaderType packetType, WimaxConnection connection);

    /**
     * Select the connection which should use the next opportunity. Does not
     * modify any connection or service flow.
     *
     * @return  Connection to serve, or null if none is eligible
     */
    WimaxConnection selectConnection();

    // =========================================================================
    // POLL-ME FLAG
    // =========================================================================

    /**
     * Record whether the station wants to be polled by its base station.
     *
     * @param pollMe    Poll-me flag
     */
    void setPollMe(boolean pollMe);

    boolean getPollMe();

}
