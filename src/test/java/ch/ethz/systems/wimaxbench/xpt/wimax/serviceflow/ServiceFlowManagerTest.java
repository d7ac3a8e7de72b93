package ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow;

import ch.ethz.systems.wimaxbench.xpt.wimax.connection.ConnectionManager;
import ch.ethz.systems.wimaxbench.xpt.wimax.connection.ConnectionType;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ServiceFlowManagerTest {

    private ConnectionManager connectionManager;
    private ServiceFlowManager serviceFlowManager;

    @BeforeEach
    void setUp() {
        connectionManager = new ConnectionManager();
        connectionManager.allocateManagementConnections();
        serviceFlowManager = new ServiceFlowManager(connectionManager);
    }

    @Test
    void addServiceFlow_allocatesTransportConnection() {
        ServiceFlow flow = serviceFlowManager.addServiceFlow(SchedulingType.BE, 0, 0);

        assertEquals(1, flow.getSfid());
        assertEquals(3, flow.getCid());
        assertEquals(ConnectionType.TRANSPORT, serviceFlowManager.getConnection(flow).getType());
        assertSame(connectionManager.getConnection(3), serviceFlowManager.getConnection(flow));
    }

    @Test
    void flowsKeptInRegistrationOrderPerType() {
        ServiceFlow be1 = serviceFlowManager.addServiceFlow(SchedulingType.BE, 0, 0);
        ServiceFlow ugs = serviceFlowManager.addServiceFlow(SchedulingType.UGS, 20, 0);
        ServiceFlow be2 = serviceFlowManager.addServiceFlow(SchedulingType.BE, 0, 0);

        assertEquals(List.of(be1, be2), serviceFlowManager.getServiceFlows(SchedulingType.BE));
        assertEquals(List.of(ugs), serviceFlowManager.getServiceFlows(SchedulingType.UGS));
        assertTrue(serviceFlowManager.getServiceFlows(SchedulingType.NRTPS).isEmpty());
        assertEquals(List.of(be1, ugs, be2), serviceFlowManager.getAllServiceFlows());
        assertThrows(UnsupportedOperationException.class,
                () -> serviceFlowManager.getServiceFlows(SchedulingType.BE).clear());
    }

    @Test
    void lookupBySfidAndCid() {
        ServiceFlow rtps = serviceFlowManager.addServiceFlow(SchedulingType.RTPS, 0, 20);

        assertSame(rtps, serviceFlowManager.getServiceFlow(rtps.getSfid()));
        assertSame(rtps, serviceFlowManager.getServiceFlowByCid(rtps.getCid()));
        assertNull(serviceFlowManager.getServiceFlow(42));
        assertNull(serviceFlowManager.getServiceFlowByCid(connectionManager.getBasicConnection().getCid()));
    }

}
