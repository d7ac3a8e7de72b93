package ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow;

import ch.ethz.systems.wimaxbench.xpt.wimax.connection.ConnectionManager;
import ch.ethz.systems.wimaxbench.xpt.wimax.connection.ConnectionType;
import ch.ethz.systems.wimaxbench.xpt.wimax.connection.WimaxConnection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the service flows of one subscriber station.
 * Flows of each scheduling type are kept in registration order.
 */
public class ServiceFlowManager {

    private final ConnectionManager connectionManager;
    private final Map<SchedulingType, List<ServiceFlow>> flowsByType;
    private final List<ServiceFlow> allFlows;
    private int nextSfid;

    /**
     * Constructor.
     *
     * @param connectionManager     Registry in which the transport connections of new flows are allocated
     */
    public ServiceFlowManager(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
        this.flowsByType = new EnumMap<>(SchedulingType.class);
        for (SchedulingType type : SchedulingType.values()) {
            flowsByType.put(type, new ArrayList<>());
        }
        this.allFlows = new ArrayList<>();
        this.nextSfid = 1;
    }

    /**
     * Create a service flow together with its transport connection.
     *
     * @param schedulingType                QoS scheduling service
     * @param unsolicitedGrantIntervalMs    Grant interval in milliseconds (UGS only)
     * @param unsolicitedPollingIntervalMs  Polling interval in milliseconds (rtPS only)
     *
     * @return  Registered service flow
     */
    public ServiceFlow addServiceFlow(SchedulingType schedulingType,
                                      long unsolicitedGrantIntervalMs, long unsolicitedPollingIntervalMs) {
        WimaxConnection connection = connectionManager.allocate(ConnectionType.TRANSPORT);
        ServiceFlow flow = new ServiceFlow(nextSfid++, connection.getCid(), schedulingType,
                unsolicitedGrantIntervalMs, unsolicitedPollingIntervalMs);
        flowsByType.get(schedulingType).add(flow);
        allFlows.add(flow);
        return flow;
    }

    /**
     * Retrieve the flows of one scheduling type in registration order.
     *
     * @param schedulingType    QoS scheduling service
     *
     * @return  Unmodifiable list of flows
     */
    public List<ServiceFlow> getServiceFlows(SchedulingType schedulingType) {
        return Collections.unmodifiableList(flowsByType.get(schedulingType));
    }

    public List<ServiceFlow> getAllServiceFlows() {
        return Collections.unmodifiableList(allFlows);
    }

    /**
     * @param sfid  Service flow identifier
     *
     * @return  Service flow, or null if unknown
     */
    public ServiceFlow getServiceFlow(int sfid) {
        for (ServiceFlow flow : allFlows) {
            if (flow.getSfid() == sfid) {
                return flow;
            }
        }
        return null;
    }

    /**
     * @param cid   Connection identifier
     *
     * @return  Service flow bound to that connection, or null if none
     */
    public ServiceFlow getServiceFlowByCid(int cid) {
        for (ServiceFlow flow : allFlows) {
            if (flow.getCid() == cid) {
                return flow;
            }
        }
        return null;
    }

    /**
     * Resolve the transport connection of a flow.
     *
     * @param flow  Service flow
     *
     * @return  Its connection
     */
    public WimaxConnection getConnection(ServiceFlow flow) {
        return connectionManager.getConnection(flow.getCid());
    }

}
