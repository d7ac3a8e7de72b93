package ch.ethz.systems.wimaxbench.xpt.wimax.scheduler;

import ch.ethz.systems.wimaxbench.core.Simulator;
import ch.ethz.systems.wimaxbench.core.log.SimulationLogger;
import ch.ethz.systems.wimaxbench.xpt.wimax.connection.ConnectionManager;
import ch.ethz.systems.wimaxbench.xpt.wimax.connection.WimaxConnection;
import ch.ethz.systems.wimaxbench.xpt.wimax.mac.MacHeaderType;
import ch.ethz.systems.wimaxbench.xpt.wimax.mac.MacPacket;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.IWimaxPhy;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.ModulationType;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.SchedulingType;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.ServiceFlow;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.ServiceFlowManager;

import java.util.function.LongSupplier;

/**
 * Uplink scheduler of a subscriber station.
 *
 * Connection selection follows a strict priority order:
 * <ol>
 *     <li>initial ranging connection</li>
 *     <li>basic connection</li>
 *     <li>primary connection</li>
 *     <li>UGS flows whose grant is due within the current frame</li>
 *     <li>rtPS flows with data whose poll is due within the current frame</li>
 *     <li>nrtPS flows with data</li>
 *     <li>BE flows with data</li>
 *     <li>broadcast connection</li>
 * </ol>
 * Within a scheduling type the first eligible flow in registration order wins.
 *
 * Bandwidth requests of rtPS, nrtPS and BE flows are never selected here: the
 * caller passes their connection to {@link #schedule} explicitly.
 */
public class SubscriberStationScheduler implements IUplinkScheduler {

    private final ConnectionManager connectionManager;
    private final ServiceFlowManager serviceFlowManager;
    private final IWimaxPhy phy;
    private final LongSupplier clock;
    private final boolean loggingEnabled;

    private boolean pollMe;

    /**
     * Scheduler reading the time from the {@link Simulator}.
     *
     * @param connectionManager     Connections of the station
     * @param serviceFlowManager    Service flows of the station
     * @param phy                   PHY of the station
     * @param loggingEnabled        Log every scheduling decision
     */
    public SubscriberStationScheduler(ConnectionManager connectionManager, ServiceFlowManager serviceFlowManager,
                                      IWimaxPhy phy, boolean loggingEnabled) {
        this(connectionManager, serviceFlowManager, phy, Simulator::getCurrentTime, loggingEnabled);
    }

    /**
     * Constructor.
     *
     * @param connectionManager     Connections of the station
     * @param serviceFlowManager    Service flows of the station
     * @param phy                   PHY of the station
     * @param clock                 Source of the current time in nanoseconds
     * @param loggingEnabled        Log every scheduling decision
     */
    public SubscriberStationScheduler(ConnectionManager connectionManager, ServiceFlowManager serviceFlowManager,
                                      IWimaxPhy phy, LongSupplier clock, boolean loggingEnabled) {
        this.connectionManager = connectionManager;
        this.serviceFlowManager = serviceFlowManager;
        this.phy = phy;
        this.clock = clock;
        this.loggingEnabled = loggingEnabled;
        this.pollMe = false;
    }

    @Override
    public void setPollMe(boolean pollMe) {
        this.pollMe = pollMe;
    }

    @Override
    public boolean getPollMe() {
        return pollMe;
    }

    @Override
    public PacketBurst schedule(int availableSymbols, ModulationType modulationType,
                                MacHeaderType packetType, WimaxConnection connection) {
        if (availableSymbols < 0) {
            throw new IllegalArgumentException("Available symbols cannot be negative: " + availableSymbols);
        }

        if (connection == null) {
            connection = selectConnection();
        } else if (!connection.hasPackets(packetType)) {
            throw new IllegalStateException("SS: Error while scheduling packets: the selected connection "
                    + connection.getCid() + " has no packets of type " + packetType);
        }

        PacketBurst burst = new PacketBurst(connection == null ? PacketBurst.NO_CID : connection.getCid());
        SymbolBudget budget = SymbolBudget.of(availableSymbols);

        while (connection != null && connection.hasPackets(packetType)) {
            int availableBytes = budget.getBytes(phy, modulationType);
            int requiredBytes = connection.getFirstPacketRequiredByte(packetType);

            if (loggingEnabled) {
                SimulationLogger.logInfo("SS_SCHEDULER", "cid=" + connection.getCid()
                        + ", availableBytes=" + availableBytes + ", requiredBytes=" + requiredBytes);
            }

            MacPacket packet;
            if (availableBytes >= requiredBytes) {
                packet = connection.dequeue(packetType);
                SimulationLogger.increaseStatisticCounter("SS_SCHEDULER_PACKETS_SCHEDULED");

            } else if (connection.getType().isFragmentable()) {
                int headerSize = connection.getFirstPacketHdrSize(packetType);
                if (!connection.checkForFragmentation(packetType)) {
                    headerSize += MacHeaderType.FRAGMENTATION_SUBHEADER_BYTES;
                }
                if (availableBytes <= headerSize) {
                    if (loggingEnabled) {
                        SimulationLogger.logInfo("SS_SCHEDULER", "fragmentation not possible, availableBytes="
                                + availableBytes + " <= headerSize=" + headerSize);
                    }
                    break;
                }
                packet = connection.dequeue(packetType, availableBytes);
                SimulationLogger.increaseStatisticCounter("SS_SCHEDULER_FRAGMENTS_SCHEDULED");
                if (loggingEnabled) {
                    SimulationLogger.logInfo("SS_SCHEDULER", "fragment of " + packet.getSizeBytes() + " bytes sent");
                }

            } else {
                if (loggingEnabled) {
                    SimulationLogger.logInfo("SS_SCHEDULER", "no fragmentation on " + connection.getType() + " connection");
                }
                break;
            }

            burst.addPacket(packet);
            budget = budget.consume(phy.getNrSymbols(packet.getSizeBytes(), modulationType));
        }

        return burst;
    }

    @Override
    public WimaxConnection selectConnection() {

        WimaxConnection ranging = connectionManager.getInitialRangingConnection();
        if (ranging.hasPackets()) {
            return selected(ranging, "initial ranging");
        }
        WimaxConnection basic = connectionManager.getBasicConnection();
        if (basic != null && basic.hasPackets()) {
            return selected(basic, "basic");
        }
        WimaxConnection primary = connectionManager.getPrimaryConnection();
        if (primary != null && primary.hasPackets()) {
            return selected(primary, "primary");
        }

        long now = clock.getAsLong();
        long frameDurationNs = phy.getFrameDurationNs();

        // UGS flows only take grants that fall due within this frame
        for (ServiceFlow flow : serviceFlowManager.getServiceFlows(SchedulingType.UGS)) {
            WimaxConnection connection = serviceFlowManager.getConnection(flow);
            if (connection.hasPackets() && flow.isDue(now, frameDurationNs)) {
                return selected(connection, "UGS sfid=" + flow.getSfid());
            }
        }

        for (ServiceFlow flow : serviceFlowManager.getServiceFlows(SchedulingType.RTPS)) {
            WimaxConnection connection = serviceFlowManager.getConnection(flow);
            if (connection.hasPackets(MacHeaderType.GENERIC) && flow.isDue(now, frameDurationNs)) {
                return selected(connection, "rtPS sfid=" + flow.getSfid());
            }
        }

        for (ServiceFlow flow : serviceFlowManager.getServiceFlows(SchedulingType.NRTPS)) {
            WimaxConnection connection = serviceFlowManager.getConnection(flow);
            if (connection.hasPackets(MacHeaderType.GENERIC)) {
                return selected(connection, "nrtPS sfid=" + flow.getSfid());
            }
        }

        for (ServiceFlow flow : serviceFlowManager.getServiceFlows(SchedulingType.BE)) {
            WimaxConnection connection = serviceFlowManager.getConnection(flow);
            if (connection.hasPackets(MacHeaderType.GENERIC)) {
                return selected(connection, "BE sfid=" + flow.getSfid());
            }
        }

        WimaxConnection broadcast = connectionManager.getBroadcastConnection();
        if (broadcast.hasPackets()) {
            return selected(broadcast, "broadcast");
        }

        if (loggingEnabled) {
            SimulationLogger.logInfo("SS_SCHEDULER", "no connection selected");
        }
        return null;
    }

    private WimaxConnection selected(WimaxConnection connection, String reason) {
        if (loggingEnabled) {
            SimulationLogger.logInfo("SS_SCHEDULER", "selected " + reason + " connection, cid=" + connection.getCid());
        }
        return connection;
    }

}
