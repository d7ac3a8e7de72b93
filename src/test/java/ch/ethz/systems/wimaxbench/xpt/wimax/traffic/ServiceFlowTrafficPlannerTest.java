package ch.ethz.systems.wimaxbench.xpt.wimax.traffic;

import ch.ethz.systems.wimaxbench.core.Simulator;
import ch.ethz.systems.wimaxbench.core.config.BaseAllowedProperties;
import ch.ethz.systems.wimaxbench.core.config.WBProperties;
import ch.ethz.systems.wimaxbench.xpt.wimax.mac.MacHeaderType;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.ModulationType;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.SimpleOfdmWimaxPhy;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.SchedulingType;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.ServiceFlow;
import ch.ethz.systems.wimaxbench.xpt.wimax.station.SubscriberStation;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ServiceFlowTrafficPlannerTest {

    private static final long DURATION_NS = 100_000_000L;

    private SubscriberStation station;

    private void setup(long seed, Properties traffic) {
        Properties properties = new Properties();
        properties.setProperty("run_folder_name", "test_traffic_planner");
        properties.setProperty("run_folder_base_dir", "temp");
        properties.putAll(traffic);
        Simulator.setup(seed, new WBProperties(properties,
                BaseAllowedProperties.LOG, BaseAllowedProperties.PROPERTIES_RUN, BaseAllowedProperties.WIMAX));

        station = new SubscriberStation(0, new SimpleOfdmWimaxPhy(), ModulationType.QPSK_12, 100, 1024, false);
    }

    @AfterEach
    void tearDown() {
        Simulator.reset();
    }

    @Test
    void ugsFlowGetsOnePacketPerGrantInterval() {
        setup(1, new Properties());
        ServiceFlow ugs = station.addServiceFlow(SchedulingType.UGS, 20, 0);

        ServiceFlowTrafficPlanner planner = new ServiceFlowTrafficPlanner(station);
        planner.createPlan(DURATION_NS);

        // Arrivals at 0, 20, 40, 60 and 80 ms
        assertEquals(5, planner.getTotalPacketsPlanned());
        assertEquals(5, Simulator.getEventSize());

        Simulator.runNs(DURATION_NS);
        assertEquals(5, station.getServiceFlowManager().getConnection(ugs).getQueue().getSize());
        assertEquals(206, station.getServiceFlowManager().getConnection(ugs).getFirstPacketRequiredByte(MacHeaderType.GENERIC));
    }

    @Test
    void polledFlowsGetPoissonArrivals() {
        Properties traffic = new Properties();
        traffic.setProperty("traffic_lambda_packet_per_s", "1000");
        traffic.setProperty("traffic_packet_size_bytes", "300");
        setup(1, traffic);
        ServiceFlow be = station.addServiceFlow(SchedulingType.BE, 0, 0);

        ServiceFlowTrafficPlanner planner = new ServiceFlowTrafficPlanner(station);
        planner.createPlan(DURATION_NS);

        // Expected 100 arrivals
        assertTrue(planner.getTotalPacketsPlanned() > 50 && planner.getTotalPacketsPlanned() < 150,
                "Planned " + planner.getTotalPacketsPlanned());

        Simulator.runNs(DURATION_NS);
        assertEquals(306, station.getServiceFlowManager().getConnection(be).getFirstPacketRequiredByte(MacHeaderType.GENERIC));
        assertTrue(station.getServiceFlowManager().getConnection(be).hasPackets(MacHeaderType.BANDWIDTH));
    }

    @Test
    void samePlanForSameSeed() {
        setup(9, new Properties());
        station.addServiceFlow(SchedulingType.NRTPS, 0, 0);
        ServiceFlowTrafficPlanner first = new ServiceFlowTrafficPlanner(station);
        first.createPlan(DURATION_NS);
        Simulator.reset();

        setup(9, new Properties());
        station.addServiceFlow(SchedulingType.NRTPS, 0, 0);
        ServiceFlowTrafficPlanner second = new ServiceFlowTrafficPlanner(station);
        second.createPlan(DURATION_NS);

        assertEquals(first.getTotalPacketsPlanned(), second.getTotalPacketsPlanned());
    }

    @Test
    void managementTrafficOnBasicConnection() {
        Properties traffic = new Properties();
        traffic.setProperty("traffic_management_lambda_packet_per_s", "500");
        setup(3, traffic);

        ServiceFlowTrafficPlanner planner = new ServiceFlowTrafficPlanner(station);
        planner.createPlan(DURATION_NS);
        Simulator.runNs(DURATION_NS);

        assertTrue(planner.getTotalPacketsPlanned() > 0);
        assertEquals(planner.getTotalPacketsPlanned(),
                station.getConnectionManager().getBasicConnection().getQueue().getEnqueuedPacketCount());
    }

    @Test
    void invalidRateRejected() {
        Properties traffic = new Properties();
        traffic.setProperty("traffic_lambda_packet_per_s", "0");
        setup(1, traffic);

        assertThrows(IllegalArgumentException.class, () -> new ServiceFlowTrafficPlanner(station));
    }

}
