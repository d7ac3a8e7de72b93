package ch.ethz.systems.wimaxbench.core.run;

import ch.ethz.systems.wimaxbench.core.Simulator;
import ch.ethz.systems.wimaxbench.core.config.exceptions.PropertyValueInvalidException;
import ch.ethz.systems.wimaxbench.core.run.traffic.TrafficPlanner;
import ch.ethz.systems.wimaxbench.xpt.wimax.mac.WimaxMacQueue;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.ModulationType;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.SimpleOfdmWimaxPhy;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.SchedulingType;
import ch.ethz.systems.wimaxbench.xpt.wimax.station.SubscriberStation;
import ch.ethz.systems.wimaxbench.xpt.wimax.station.SubscriberStationGenerator;
import ch.ethz.systems.wimaxbench.xpt.wimax.traffic.ServiceFlowTrafficPlanner;

import java.util.ArrayList;
import java.util.List;

class InfrastructureSelector {

    private InfrastructureSelector() {
        // Only static class
    }

    /**
     * Select the subscriber station generator based on the run configuration.
     *
     * Selected using following properties:
     * wimax_phy=simple_ofdm
     * wimax_modulation=qpsk_12 | qpsk_34 | qam16_12 | ...
     * wimax_service_flows=UGS,RTPS,NRTPS,BE
     *
     * @return  Subscriber station generator
     */
    static SubscriberStationGenerator selectSubscriberStationGenerator() {

        String modulationName = Simulator.getConfiguration().getPropertyWithDefault("wimax_modulation", "qpsk_12");
        ModulationType modulationType;
        try {
            modulationType = ModulationType.fromName(modulationName);
        } catch (IllegalArgumentException e) {
            throw new PropertyValueInvalidException("wimax_modulation", modulationName, e);
        }

        int symbolsPerFrame = Simulator.getConfiguration().getIntegerPropertyWithDefault("wimax_uplink_symbols_per_frame", 100);
        if (symbolsPerFrame < 0) {
            throw new PropertyValueInvalidException("wimax_uplink_symbols_per_frame", Integer.toString(symbolsPerFrame));
        }

        long frameDurationNs = Simulator.getConfiguration().getLongPropertyWithDefault(
                "wimax_frame_duration_ns", SimpleOfdmWimaxPhy.DEFAULT_FRAME_DURATION_NS);
        if (frameDurationNs <= 0) {
            throw new PropertyValueInvalidException("wimax_frame_duration_ns", Long.toString(frameDurationNs));
        }

        return new SubscriberStationGenerator(
                Simulator.getConfiguration().getPropertyWithDefault("wimax_phy", "simple_ofdm"),
                frameDurationNs,
                modulationType,
                symbolsPerFrame,
                Simulator.getConfiguration().getIntegerPropertyWithDefault("wimax_mac_queue_max_size", WimaxMacQueue.DEFAULT_MAX_SIZE),
                parseServiceFlowTypes(Simulator.getConfiguration().getPropertyWithDefault("wimax_service_flows", "")),
                Simulator.getConfiguration().getLongPropertyWithDefault("wimax_ugs_grant_interval_ms", 20),
                Simulator.getConfiguration().getLongPropertyWithDefault("wimax_rtps_polling_interval_ms", 20),
                Simulator.getConfiguration().getBooleanPropertyWithDefault("enable_log_scheduler_decisions", false)
        );
    }

    private static List<SchedulingType> parseServiceFlowTypes(String list) {
        List<SchedulingType> types = new ArrayList<>();
        for (String name : list.split(",")) {
            if (name.trim().isEmpty()) {
                continue;
            }
            try {
                types.add(SchedulingType.fromName(name));
            } catch (IllegalArgumentException e) {
                throw new PropertyValueInvalidException("wimax_service_flows", list, e);
            }
        }
        return types;
    }

    /**
     * Select the traffic planner based on the run configuration.
     *
     * Selected using following property:
     * traffic=service_flow
     *
     * @param station   Station whose traffic is planned
     *
     * @return  Traffic planner
     */
    static TrafficPlanner selectTrafficPlanner(SubscriberStation station) {

        String traffic = Simulator.getConfiguration().getPropertyWithDefault("traffic", "service_flow");
        switch (traffic) {

            case "service_flow":
                return new ServiceFlowTrafficPlanner(station);

            default:
                throw new PropertyValueInvalidException("traffic", traffic);

        }

    }

}
