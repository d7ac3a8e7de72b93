package ch.ethz.systems.wimaxbench.xpt.wimax.traffic;

import ch.ethz.systems.wimaxbench.core.Simulator;
import ch.ethz.systems.wimaxbench.core.log.SimulationLogger;
import ch.ethz.systems.wimaxbench.core.run.traffic.TrafficPlanner;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.SchedulingType;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.ServiceFlow;
import ch.ethz.systems.wimaxbench.xpt.wimax.station.SubscriberStation;

import java.util.Random;

/**
 * Plans the uplink traffic of a subscriber station per service flow:
 * <ul>
 *     <li>UGS flows: constant-size packets, one per grant interval</li>
 *     <li>rtPS, nrtPS and BE flows: Poisson arrivals of fixed-size packets</li>
 *     <li>basic connection: Poisson arrivals of management messages (if the rate is positive)</li>
 * </ul>
 *
 * Configuration properties:
 *   traffic_lambda_packet_per_s=100            (default: 100)
 *   traffic_packet_size_bytes=1000             (default: 1000)
 *   traffic_ugs_packet_size_bytes=200          (default: 200)
 *   traffic_management_lambda_packet_per_s=0   (default: 0, disabled)
 *   traffic_management_packet_size_bytes=40    (default: 40)
 */
public class ServiceFlowTrafficPlanner extends TrafficPlanner {

    private final SubscriberStation station;
    private final double lambdaPacketPerS;
    private final int packetSizeBytes;
    private final int ugsPacketSizeBytes;
    private final double managementLambdaPacketPerS;
    private final int managementPacketSizeBytes;
    private final Random rng;

    private long totalPacketsPlanned = 0;

    public ServiceFlowTrafficPlanner(SubscriberStation station) {
        this.station = station;

        // Read configuration parameters
        this.lambdaPacketPerS = Simulator.getConfiguration().getDoublePropertyWithDefault("traffic_lambda_packet_per_s", 100.0);
        this.packetSizeBytes = Simulator.getConfiguration().getIntegerPropertyWithDefault("traffic_packet_size_bytes", 1000);
        this.ugsPacketSizeBytes = Simulator.getConfiguration().getIntegerPropertyWithDefault("traffic_ugs_packet_size_bytes", 200);
        this.managementLambdaPacketPerS = Simulator.getConfiguration().getDoublePropertyWithDefault("traffic_management_lambda_packet_per_s", 0.0);
        this.managementPacketSizeBytes = Simulator.getConfiguration().getIntegerPropertyWithDefault("traffic_management_packet_size_bytes", 40);

        if (lambdaPacketPerS <= 0) {
            throw new IllegalArgumentException("traffic_lambda_packet_per_s must be positive: " + lambdaPacketPerS);
        }
        if (packetSizeBytes <= 0 || ugsPacketSizeBytes <= 0 || managementPacketSizeBytes <= 0) {
            throw new IllegalArgumentException("Packet sizes must be positive");
        }

        this.rng = Simulator.selectIndependentRandom("service_flow_traffic_planner");

        // Log configuration
        SimulationLogger.logInfo("Traffic planner", "ServiceFlowTrafficPlanner");
        SimulationLogger.logInfo("Traffic lambda (packets/s)", Double.toString(lambdaPacketPerS));
        SimulationLogger.logInfo("Traffic packet size (bytes)", Integer.toString(packetSizeBytes));
        SimulationLogger.logInfo("Traffic UGS packet size (bytes)", Integer.toString(ugsPacketSizeBytes));
        SimulationLogger.logInfo("Traffic management lambda (packets/s)", Double.toString(managementLambdaPacketPerS));
    }

    @Override
    public void createPlan(long durationNs) {
        for (ServiceFlow flow : station.getServiceFlowManager().getAllServiceFlows()) {
            if (flow.getSchedulingType() == SchedulingType.UGS) {
                planPeriodic(flow.getCid(), flow.getIntervalNs(), ugsPacketSizeBytes, durationNs);
            } else {
                planPoisson(flow.getCid(), lambdaPacketPerS, packetSizeBytes, durationNs);
            }
        }
        if (managementLambdaPacketPerS > 0) {
            planPoisson(station.getConnectionManager().getBasicConnection().getCid(),
                    managementLambdaPacketPerS, managementPacketSizeBytes, durationNs);
        }

        SimulationLogger.logInfo("TRAFFIC_PLAN_TOTAL_PACKETS", Long.toString(totalPacketsPlanned));
        System.out.println("Traffic plan created: " + totalPacketsPlanned + " packets over " + durationNs + " ns");
    }

    private void planPeriodic(int cid, long intervalNs, int sizeBytes, long durationNs) {
        if (intervalNs <= 0) {
            throw new IllegalArgumentException("UGS flow on CID " + cid + " has no grant interval");
        }
        for (long timeNs = 0; timeNs < durationNs; timeNs += intervalNs) {
            registerArrival(timeNs, cid, sizeBytes);
        }
    }

    private void planPoisson(int cid, double lambdaPerS, int sizeBytes, long durationNs) {
        long currentTimeNs = 0;
        while (true) {
            double u = rng.nextDouble();
            long interArrivalTimeNs = (long) (-Math.log(1.0 - u) / lambdaPerS * 1e9);

            // Enforce a minimum of 1 ns to avoid zero arrival time
            if (interArrivalTimeNs < 1) {
                interArrivalTimeNs = 1;
            }
            currentTimeNs += interArrivalTimeNs;
            if (currentTimeNs >= durationNs) {
                break;
            }
            registerArrival(currentTimeNs, cid, sizeBytes);
        }
    }

    private void registerArrival(long timeNs, int cid, int sizeBytes) {
        Simulator.registerEvent(new PacketArrivalEvent(timeNs - Simulator.getCurrentTime(), station, cid, sizeBytes));
        totalPacketsPlanned++;
    }

    public long getTotalPacketsPlanned() {
        return totalPacketsPlanned;
    }

}
