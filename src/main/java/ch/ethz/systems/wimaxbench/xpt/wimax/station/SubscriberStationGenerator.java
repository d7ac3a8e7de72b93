package ch.ethz.systems.wimaxbench.xpt.wimax.station;

import ch.ethz.systems.wimaxbench.core.log.SimulationLogger;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.IWimaxPhy;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.ModulationType;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.SimpleOfdmWimaxPhy;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.SchedulingType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Generates subscriber stations with their PHY and service flows.
 * Receives all configuration via constructor parameters and chooses
 * the PHY implementation based on the phyType parameter.
 */
public class SubscriberStationGenerator {

    private final String phyType;
    private final long frameDurationNs;
    private final ModulationType modulationType;
    private final int uplinkSymbolsPerFrame;
    private final int queueMaxSize;
    private final List<SchedulingType> serviceFlowTypes;
    private final long ugsGrantIntervalMs;
    private final long rtpsPollingIntervalMs;
    private final boolean schedulerLoggingEnabled;

    /**
     * Constructor.
     *
     * @param phyType                   PHY implementation ("simple_ofdm")
     * @param frameDurationNs           Frame duration in nanoseconds
     * @param modulationType            Uplink modulation
     * @param uplinkSymbolsPerFrame     Symbols granted per frame
     * @param queueMaxSize              Maximum packets per connection queue
     * @param serviceFlowTypes          Scheduling types of the service flows, in registration order
     * @param ugsGrantIntervalMs        Grant interval of UGS flows
     * @param rtpsPollingIntervalMs     Polling interval of rtPS flows
     * @param schedulerLoggingEnabled   Log every scheduling decision
     */
    public SubscriberStationGenerator(
            String phyType,
            long frameDurationNs,
            ModulationType modulationType,
            int uplinkSymbolsPerFrame,
            int queueMaxSize,
            List<SchedulingType> serviceFlowTypes,
            long ugsGrantIntervalMs,
            long rtpsPollingIntervalMs,
            boolean schedulerLoggingEnabled
    ) {
        // Normalize phyType for consistent matching
        this.phyType = (phyType != null) ? phyType.toLowerCase() : "simple_ofdm";
        this.frameDurationNs = frameDurationNs;
        this.modulationType = modulationType;
        this.uplinkSymbolsPerFrame = uplinkSymbolsPerFrame;
        this.queueMaxSize = queueMaxSize;
        this.serviceFlowTypes = Collections.unmodifiableList(new ArrayList<>(serviceFlowTypes));
        this.ugsGrantIntervalMs = ugsGrantIntervalMs;
        this.rtpsPollingIntervalMs = rtpsPollingIntervalMs;
        this.schedulerLoggingEnabled = schedulerLoggingEnabled;
    }

    /**
     * Generate a station with all configured service flows registered.
     *
     * @param identifier    Station identifier
     *
     * @return  Subscriber station
     */
    public SubscriberStation generate(int identifier) {
        IWimaxPhy phy;

        switch (this.phyType) {
            case "simple_ofdm":
            case "ofdm":
                phy = new SimpleOfdmWimaxPhy(frameDurationNs);
                break;

            default:
                System.err.println("Warning: Unknown PHY type '" + this.phyType + "' encountered in generate(). Defaulting to simple_ofdm.");
                phy = new SimpleOfdmWimaxPhy(frameDurationNs);
                break;
        }

        SubscriberStation station = new SubscriberStation(identifier, phy, modulationType,
                uplinkSymbolsPerFrame, queueMaxSize, schedulerLoggingEnabled);
        for (SchedulingType type : serviceFlowTypes) {
            station.addServiceFlow(type, ugsGrantIntervalMs, rtpsPollingIntervalMs);
        }

        SimulationLogger.logInfo("SS_" + identifier + "_GENERATED", "phy=" + phyType + ", modulation=" + modulationType
                + ", symbolsPerFrame=" + uplinkSymbolsPerFrame + ", serviceFlows=" + serviceFlowTypes);
        return station;
    }

}
