package ch.ethz.systems.wimaxbench.core.run;

import ch.ethz.systems.wimaxbench.core.Simulator;
import ch.ethz.systems.wimaxbench.core.config.BaseAllowedProperties;
import ch.ethz.systems.wimaxbench.core.config.WBProperties;
import ch.ethz.systems.wimaxbench.core.log.SimulationLogger;
import ch.ethz.systems.wimaxbench.core.run.traffic.TrafficPlanner;
import ch.ethz.systems.wimaxbench.xpt.wimax.station.SubscriberStation;
import ch.ethz.systems.wimaxbench.xpt.wimax.station.UplinkFrameEvent;

/**
 * Runs a simulation of a subscriber station's uplink from a properties file.
 *
 * Usage: <code>MainFromProperties run.properties [key=value ...]</code>
 */
public class MainFromProperties {

    public static void main(String[] args) {

        // Load in the configuration properties
        WBProperties runConfiguration = generateRunConfigurationFromArgs(args);

        // Setup simulator (also opens the logger)
        Simulator.setup(runConfiguration.getLongPropertyWithDefault("seed", 0), runConfiguration);

        // Create the station and its traffic
        SubscriberStation station = InfrastructureSelector.selectSubscriberStationGenerator().generate(0);
        TrafficPlanner planner = InfrastructureSelector.selectTrafficPlanner(station);

        long runtimeNs = determineRuntimeNs(runConfiguration);
        planner.createPlan(runtimeNs);

        // The first frame starts at time zero
        Simulator.registerEvent(new UplinkFrameEvent(0, station));
        Simulator.runNs(runtimeNs);

        // Summary
        SimulationLogger.logInfo("SS_BURSTS_TRANSMITTED", Long.toString(station.getBurstsTransmitted()));
        SimulationLogger.logInfo("SS_BYTES_TRANSMITTED", Long.toString(station.getBytesTransmitted()));
        SimulationLogger.logInfo("SS_EMPTY_OPPORTUNITIES", Long.toString(station.getEmptyOpportunities()));
        System.out.println("Bursts transmitted: " + station.getBurstsTransmitted()
                + ", bytes transmitted: " + station.getBytesTransmitted()
                + ", empty opportunities: " + station.getEmptyOpportunities());

        // Finalize the run folder
        Simulator.reset(false);
    }

    /**
     * Load the run configuration from the properties file given as first argument,
     * and apply the remaining <code>key=value</code> arguments as overrides.
     *
     * @param args  Command line arguments
     *
     * @return  Run configuration
     */
    static WBProperties generateRunConfigurationFromArgs(String[] args) {
        if (args.length < 1) {
            throw new IllegalArgumentException("Usage: MainFromProperties <run.properties> [key=value ...]");
        }

        WBProperties runConfiguration = new WBProperties(
                args[0],
                BaseAllowedProperties.LOG,
                BaseAllowedProperties.PROPERTIES_RUN,
                BaseAllowedProperties.WIMAX
        );

        for (int i = 1; i < args.length; i++) {
            String[] split = args[i].split("=", 2);
            if (split.length != 2) {
                throw new IllegalArgumentException("Invalid override argument (expected key=value): " + args[i]);
            }
            runConfiguration.overrideProperty(split[0].trim(), split[1].trim());
        }

        return runConfiguration;
    }

    static long determineRuntimeNs(WBProperties runConfiguration) {
        if (runConfiguration.isPropertyDefined("run_time_ns")) {
            return runConfiguration.getLongPropertyOrFail("run_time_ns");
        }
        return (long) (runConfiguration.getDoublePropertyOrFail("run_time_s") * 1e9);
    }

}
