package ch.ethz.systems.wimaxbench.xpt.wimax.station;

import ch.ethz.systems.wimaxbench.core.Simulator;
import ch.ethz.systems.wimaxbench.core.log.SimulationLogger;
import ch.ethz.systems.wimaxbench.xpt.wimax.connection.ConnectionManager;
import ch.ethz.systems.wimaxbench.xpt.wimax.connection.WimaxConnection;
import ch.ethz.systems.wimaxbench.xpt.wimax.mac.MacHeaderType;
import ch.ethz.systems.wimaxbench.xpt.wimax.mac.MacPacket;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.IWimaxPhy;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.ModulationType;
import ch.ethz.systems.wimaxbench.xpt.wimax.scheduler.IUplinkScheduler;
import ch.ethz.systems.wimaxbench.xpt.wimax.scheduler.PacketBurst;
import ch.ethz.systems.wimaxbench.xpt.wimax.scheduler.SubscriberStationScheduler;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.SchedulingType;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.ServiceFlow;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.ServiceFlowManager;

import java.util.ArrayList;
import java.util.List;

/**
 * Subscriber station: owns the PHY, the connections, the service flows and
 * the uplink scheduler, and uses one uplink opportunity per frame.
 *
 * In each opportunity the scheduler first selects a connection and sends its
 * data. Symbols left over are then offered to pending bandwidth requests of
 * polled service flows (rtPS, nrtPS, BE), which are passed to the scheduler
 * explicitly.
 */
public class SubscriberStation {

    private final int identifier;
    private final IWimaxPhy phy;
    private final ModulationType modulationType;
    private final int uplinkSymbolsPerFrame;

    private final ConnectionManager connectionManager;
    private final ServiceFlowManager serviceFlowManager;
    private final IUplinkScheduler scheduler;

    // Per-station sequence numbers of generated packets
    private long nextSequenceNumber;

    private long burstsTransmitted;
    private long bytesTransmitted;
    private long emptyOpportunities;

    /**
     * Constructor.
     *
     * @param identifier                Station identifier
     * @param phy                       PHY model
     * @param modulationType            Modulation used on the uplink
     * @param uplinkSymbolsPerFrame     Symbols granted to the station per frame
     * @param queueMaxSize              Maximum number of packets per connection queue
     * @param schedulerLoggingEnabled   Log every scheduling decision
     */
    public SubscriberStation(int identifier, IWimaxPhy phy, ModulationType modulationType,
                             int uplinkSymbolsPerFrame, int queueMaxSize, boolean schedulerLoggingEnabled) {
        if (uplinkSymbolsPerFrame < 0) {
            throw new IllegalArgumentException("Uplink symbols per frame cannot be negative: " + uplinkSymbolsPerFrame);
        }
        this.identifier = identifier;
        this.phy = phy;
        this.modulationType = modulationType;
        this.uplinkSymbolsPerFrame = uplinkSymbolsPerFrame;

        this.connectionManager = new ConnectionManager(queueMaxSize);
        this.connectionManager.allocateManagementConnections();
        this.serviceFlowManager = new ServiceFlowManager(connectionManager);
        this.scheduler = new SubscriberStationScheduler(connectionManager, serviceFlowManager, phy, schedulerLoggingEnabled);

        this.nextSequenceNumber = 0;
        this.burstsTransmitted = 0;
        this.bytesTransmitted = 0;
        this.emptyOpportunities = 0;
    }

    /**
     * Register a new service flow (and its transport connection).
     *
     * @param schedulingType                QoS scheduling service
     * @param unsolicitedGrantIntervalMs    Grant interval (UGS)
     * @param unsolicitedPollingIntervalMs  Polling interval (rtPS)
     *
     * @return  Service flow
     */
    public ServiceFlow addServiceFlow(SchedulingType schedulingType,
                                      long unsolicitedGrantIntervalMs, long unsolicitedPollingIntervalMs) {
        ServiceFlow flow = serviceFlowManager.addServiceFlow(schedulingType, unsolicitedGrantIntervalMs, unsolicitedPollingIntervalMs);
        SimulationLogger.logInfo("SS_" + identifier + "_SERVICE_FLOW", flow.toString());
        return flow;
    }

    /**
     * Enqueue a data packet of the given payload on a connection. For polled
     * service flows (rtPS, nrtPS, BE) a bandwidth request for the queued data is
     * enqueued as well, unless one is already pending.
     *
     * @param cid           Connection identifier
     * @param payloadBytes  Payload size
     *
     * @return  True iff the data packet was enqueued
     */
    public boolean enqueueData(int cid, int payloadBytes) {
        WimaxConnection connection = connectionManager.getConnection(cid);
        if (connection == null) {
            throw new IllegalArgumentException("Station " + identifier + " has no connection with CID " + cid);
        }
        ServiceFlow flow = serviceFlowManager.getServiceFlowByCid(cid);
        long flowId = flow == null ? 0 : flow.getSfid();

        boolean enqueued = connection.enqueue(MacPacket.data(flowId, nextSequenceNumber++, cid, payloadBytes));
        if (enqueued && flow != null && flow.getSchedulingType() != SchedulingType.UGS
                && !connection.hasPackets(MacHeaderType.BANDWIDTH)) {
            int requestedBytes = (int) Math.min(Integer.MAX_VALUE, connection.getQueue().getNBytes());
            connection.enqueue(MacPacket.bandwidthRequest(flowId, nextSequenceNumber++, cid, requestedBytes));
        }
        return enqueued;
    }

    /**
     * Use the uplink opportunity of the current frame.
     *
     * @return  Bursts transmitted (data burst first, then bandwidth requests); empty bursts are omitted
     */
    public List<PacketBurst> onUplinkOpportunity() {
        long now = Simulator.getCurrentTime();
        List<PacketBurst> transmitted = new ArrayList<>();

        int remainingSymbols = uplinkSymbolsPerFrame;
        PacketBurst dataBurst = scheduler.schedule(remainingSymbols, modulationType, MacHeaderType.GENERIC, null);
        if (!dataBurst.isEmpty()) {
            ServiceFlow flow = serviceFlowManager.getServiceFlowByCid(dataBurst.getCid());
            if (flow != null) {
                flow.markServed(now);
            }
            remainingSymbols -= transmit(now, dataBurst, remainingSymbols);
            transmitted.add(dataBurst);
        }

        for (ServiceFlow flow : serviceFlowManager.getAllServiceFlows()) {
            WimaxConnection connection = serviceFlowManager.getConnection(flow);
            if (remainingSymbols <= 0 || !connection.hasPackets(MacHeaderType.BANDWIDTH)) {
                continue;
            }
            PacketBurst requestBurst = scheduler.schedule(remainingSymbols, modulationType, MacHeaderType.BANDWIDTH, connection);
            if (!requestBurst.isEmpty()) {
                remainingSymbols -= transmit(now, requestBurst, remainingSymbols);
                transmitted.add(requestBurst);
            }
        }

        if (transmitted.isEmpty()) {
            emptyOpportunities++;
            SimulationLogger.increaseStatisticCounter("SS_EMPTY_UPLINK_OPPORTUNITIES");
        }

        // Ask to be polled while traffic is still waiting
        scheduler.setPollMe(connectionManager.hasPackets());
        return transmitted;
    }

    private int transmit(long now, PacketBurst burst, int symbolsAvailable) {
        int symbolsUsed = 0;
        for (MacPacket packet : burst.getPackets()) {
            symbolsUsed += phy.getNrSymbols(packet.getSizeBytes(), modulationType);
        }
        burstsTransmitted++;
        bytesTransmitted += burst.getSizeBytes();
        SimulationLogger.increaseStatisticCounter("SS_UPLINK_BURSTS_TRANSMITTED");
        SimulationLogger.increaseStatisticCounter("SS_UPLINK_BYTES_TRANSMITTED", burst.getSizeBytes());
        SimulationLogger.logUplinkBurst(now, burst.getCid(), burst.getNrPackets(), burst.getSizeBytes(),
                symbolsUsed, symbolsAvailable);
        return symbolsUsed;
    }

    public int getIdentifier() {
        return identifier;
    }

    public IWimaxPhy getPhy() {
        return phy;
    }

    public ModulationType getModulationType() {
        return modulationType;
    }

    public int getUplinkSymbolsPerFrame() {
        return uplinkSymbolsPerFrame;
    }

    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }

    public ServiceFlowManager getServiceFlowManager() {
        return serviceFlowManager;
    }

    public IUplinkScheduler getScheduler() {
        return scheduler;
    }

    public long getBurstsTransmitted() {
        return burstsTransmitted;
    }

    public long getBytesTransmitted() {
        return bytesTransmitted;
    }

    public long getEmptyOpportunities() {
        return emptyOpportunities;
    }

}
