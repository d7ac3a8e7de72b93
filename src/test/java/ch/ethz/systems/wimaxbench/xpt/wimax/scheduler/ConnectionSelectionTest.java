package ch.ethz.systems.wimaxbench.xpt.wimax.scheduler;

import ch.ethz.systems.wimaxbench.xpt.wimax.connection.ConnectionManager;
import ch.ethz.systems.wimaxbench.xpt.wimax.connection.WimaxConnection;
import ch.ethz.systems.wimaxbench.xpt.wimax.mac.MacHeaderType;
import ch.ethz.systems.wimaxbench.xpt.wimax.mac.MacPacket;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.IWimaxPhy;
import ch.ethz.systems.wimaxbench.xpt.wimax.phy.ModulationType;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.SchedulingType;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.ServiceFlow;
import ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow.ServiceFlowManager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the priority order in which the subscriber station scheduler
 * selects the connection to serve.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ConnectionSelectionTest {

    private static final long FRAME_DURATION_NS = 10_000_000L;
    private static final long GRANT_INTERVAL_MS = 20;
    private static final long POLLING_INTERVAL_MS = 20;

    @Mock
    private IWimaxPhy phy;

    private final AtomicLong now = new AtomicLong(0);

    private ConnectionManager connectionManager;
    private ServiceFlowManager serviceFlowManager;
    private SubscriberStationScheduler scheduler;

    @BeforeEach
    void setUp() {
        when(phy.getFrameDurationNs()).thenReturn(FRAME_DURATION_NS);
        when(phy.getNrBytes(anyInt(), any(ModulationType.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(phy.getNrSymbols(anyInt(), any(ModulationType.class))).thenAnswer(invocation -> invocation.getArgument(0));

        now.set(0);
        connectionManager = new ConnectionManager();
        connectionManager.allocateManagementConnections();
        serviceFlowManager = new ServiceFlowManager(connectionManager);
        scheduler = new SubscriberStationScheduler(connectionManager, serviceFlowManager, phy, now::get, false);
    }

    private WimaxConnection flow(SchedulingType type) {
        ServiceFlow flow = serviceFlowManager.addServiceFlow(type, GRANT_INTERVAL_MS, POLLING_INTERVAL_MS);
        return serviceFlowManager.getConnection(flow);
    }

    private static void data(WimaxConnection connection) {
        assertTrue(connection.enqueue(MacPacket.data(1, 0, connection.getCid(), 100)));
    }

    private static void bandwidthRequest(WimaxConnection connection) {
        assertTrue(connection.enqueue(MacPacket.bandwidthRequest(1, 0, connection.getCid(), 100)));
    }

    @Test
    @DisplayName("Nothing queued anywhere selects no connection")
    void nothingQueued_null() {
        flow(SchedulingType.UGS);
        flow(SchedulingType.BE);
        assertNull(scheduler.selectConnection());
    }

    @Test
    @DisplayName("Initial ranging wins over every other connection")
    void rangingWinsOverEverything() {
        now.set(100_000_000L);
        WimaxConnection ugs = flow(SchedulingType.UGS);
        WimaxConnection rtps = flow(SchedulingType.RTPS);
        WimaxConnection nrtps = flow(SchedulingType.NRTPS);
        WimaxConnection be = flow(SchedulingType.BE);
        data(ugs);
        data(rtps);
        data(nrtps);
        data(be);
        data(connectionManager.getBasicConnection());
        data(connectionManager.getPrimaryConnection());
        data(connectionManager.getBroadcastConnection());
        data(connectionManager.getInitialRangingConnection());

        assertSame(connectionManager.getInitialRangingConnection(), scheduler.selectConnection());
    }

    @Test
    @DisplayName("Priority order is peeled off one connection at a time")
    void fullPriorityOrder() {
        now.set(100_000_000L);
        WimaxConnection be = flow(SchedulingType.BE);
        WimaxConnection nrtps = flow(SchedulingType.NRTPS);
        WimaxConnection rtps = flow(SchedulingType.RTPS);
        WimaxConnection ugs = flow(SchedulingType.UGS);
        WimaxConnection basic = connectionManager.getBasicConnection();
        WimaxConnection primary = connectionManager.getPrimaryConnection();
        WimaxConnection broadcast = connectionManager.getBroadcastConnection();

        WimaxConnection[] expectedOrder = {basic, primary, ugs, rtps, nrtps, be, broadcast};
        for (WimaxConnection connection : expectedOrder) {
            data(connection);
        }

        for (WimaxConnection expected : expectedOrder) {
            WimaxConnection selected = scheduler.selectConnection();
            assertSame(expected, selected);
            selected.dequeue(MacHeaderType.GENERIC);
        }
        assertNull(scheduler.selectConnection());
    }

    @Test
    @DisplayName("Selection is read-only and repeatable")
    void selectionIsIdempotent() {
        WimaxConnection be = flow(SchedulingType.BE);
        data(be);
        data(be);
        data(connectionManager.getPrimaryConnection());

        WimaxConnection first = scheduler.selectConnection();
        WimaxConnection second = scheduler.selectConnection();

        assertSame(first, second);
        assertEquals(2, be.getQueue().getSize());
        assertEquals(1, connectionManager.getPrimaryConnection().getQueue().getSize());
    }

    @Test
    @DisplayName("Management connections that were never allocated are skipped")
    void unallocatedManagementConnections() {
        ConnectionManager bare = new ConnectionManager();
        ServiceFlowManager flows = new ServiceFlowManager(bare);
        SubscriberStationScheduler bareScheduler = new SubscriberStationScheduler(bare, flows, phy, now::get, false);

        assertNull(bareScheduler.selectConnection());

        data(bare.getBroadcastConnection());
        assertSame(bare.getBroadcastConnection(), bareScheduler.selectConnection());
    }

    @Nested
    @DisplayName("Unsolicited grant service")
    class UgsGating {

        @Test
        @DisplayName("Grant not yet due is skipped in favour of best effort")
        void notDue_skipped() {
            WimaxConnection ugs = flow(SchedulingType.UGS);
            WimaxConnection be = flow(SchedulingType.BE);
            data(ugs);
            data(be);

            // Deadline at 20 ms, the frame starting at 10 ms ends exactly on it
            now.set(10_000_000L);
            assertSame(be, scheduler.selectConnection());
        }

        @Test
        @DisplayName("Grant falling due within the frame is selected")
        void due_selected() {
            WimaxConnection ugs = flow(SchedulingType.UGS);
            WimaxConnection be = flow(SchedulingType.BE);
            data(ugs);
            data(be);

            now.set(10_000_001L);
            assertSame(ugs, scheduler.selectConnection());
        }

        @Test
        @DisplayName("Serving a grant moves the next one a full interval ahead")
        void served_nextGrantLater() {
            WimaxConnection ugs = flow(SchedulingType.UGS);
            data(ugs);
            ServiceFlow flow = serviceFlowManager.getServiceFlowByCid(ugs.getCid());

            now.set(15_000_000L);
            assertSame(ugs, scheduler.selectConnection());
            flow.markServed(now.get());

            now.set(25_000_000L);
            assertNull(scheduler.selectConnection());
            now.set(30_000_000L);
            assertSame(ugs, scheduler.selectConnection());
        }

        @Test
        @DisplayName("Due grant with nothing queued is skipped")
        void dueButEmpty_skipped() {
            flow(SchedulingType.UGS);
            WimaxConnection rtps = flow(SchedulingType.RTPS);
            data(rtps);

            now.set(50_000_000L);
            assertSame(rtps, scheduler.selectConnection());
        }

    }

    @Nested
    @DisplayName("Real-time polling service")
    class RtpsGating {

        @Test
        @DisplayName("Bandwidth requests alone do not make a flow eligible")
        void bandwidthRequestOnly_skipped() {
            WimaxConnection rtps = flow(SchedulingType.RTPS);
            bandwidthRequest(rtps);

            now.set(50_000_000L);
            assertNull(scheduler.selectConnection());
        }

        @Test
        @DisplayName("Poll not yet due is skipped in favour of non-real-time polling")
        void notDue_skipped() {
            WimaxConnection rtps = flow(SchedulingType.RTPS);
            WimaxConnection nrtps = flow(SchedulingType.NRTPS);
            data(rtps);
            data(nrtps);

            assertSame(nrtps, scheduler.selectConnection());
            now.set(11_000_000L);
            assertSame(rtps, scheduler.selectConnection());
        }

        @Test
        @DisplayName("UGS is preferred over a due rtPS flow")
        void ugsBeforeRtps() {
            WimaxConnection rtps = flow(SchedulingType.RTPS);
            WimaxConnection ugs = flow(SchedulingType.UGS);
            data(rtps);
            data(ugs);

            now.set(11_000_000L);
            assertSame(ugs, scheduler.selectConnection());
        }

    }

    @Nested
    @DisplayName("Polled and best effort flows")
    class PolledFlows {

        @Test
        @DisplayName("nrtPS is preferred over BE regardless of registration order")
        void nrtpsBeforeBe() {
            WimaxConnection be = flow(SchedulingType.BE);
            WimaxConnection nrtps = flow(SchedulingType.NRTPS);
            data(be);
            data(nrtps);

            assertSame(nrtps, scheduler.selectConnection());
        }

        @Test
        @DisplayName("First eligible BE flow in registration order wins")
        void firstRegisteredWins() {
            WimaxConnection first = flow(SchedulingType.BE);
            WimaxConnection second = flow(SchedulingType.BE);
            data(second);
            data(second);
            data(first);

            assertSame(first, scheduler.selectConnection());
        }

        @Test
        @DisplayName("Empty earlier flow is passed over for a later one")
        void emptyEarlierFlowSkipped() {
            flow(SchedulingType.BE);
            WimaxConnection second = flow(SchedulingType.BE);
            data(second);

            assertSame(second, scheduler.selectConnection());
        }

        @Test
        @DisplayName("BE flow with only a bandwidth request is not selected")
        void bandwidthRequestOnly_skipped() {
            WimaxConnection be = flow(SchedulingType.BE);
            bandwidthRequest(be);
            data(connectionManager.getBroadcastConnection());

            assertSame(connectionManager.getBroadcastConnection(), scheduler.selectConnection());
        }

    }

}
