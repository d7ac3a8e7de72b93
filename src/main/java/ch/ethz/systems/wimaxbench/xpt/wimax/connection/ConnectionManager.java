package ch.ethz.systems.wimaxbench.xpt.wimax.connection;

import ch.ethz.systems.wimaxbench.xpt.wimax.mac.WimaxMacQueue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the connections of one subscriber station.
 *
 * Connections are referred to by their CID; other components keep the CID
 * as a handle and resolve it here. The initial ranging (CID 0) and broadcast
 * (CID 0xFFFF) connections exist from construction on; basic, primary and
 * transport connections are allocated with increasing CIDs starting at 1.
 */
public class ConnectionManager {

    public static final int INITIAL_RANGING_CID = 0x0000;
    public static final int BROADCAST_CID = 0xFFFF;
    private static final int MAX_ALLOCATABLE_CID = 0xFEFE;

    private final int queueMaxSize;
    private final Map<Integer, WimaxConnection> connections;
    private int nextCid;

    private Integer basicCid = null;
    private Integer primaryCid = null;

    public ConnectionManager() {
        this(WimaxMacQueue.DEFAULT_MAX_SIZE);
    }

    /**
     * Constructor.
     *
     * @param queueMaxSize  Maximum number of packets in the queue of each connection
     */
    public ConnectionManager(int queueMaxSize) {
        this.queueMaxSize = queueMaxSize;
        this.connections = new LinkedHashMap<>();
        this.nextCid = 1;
        register(new WimaxConnection(INITIAL_RANGING_CID, ConnectionType.INITIAL_RANGING, new WimaxMacQueue(queueMaxSize)));
        register(new WimaxConnection(BROADCAST_CID, ConnectionType.BROADCAST, new WimaxMacQueue(queueMaxSize)));
    }

    private void register(WimaxConnection connection) {
        connections.put(connection.getCid(), connection);
    }

    /**
     * Allocate the basic and primary management connections.
     * Called once the station has completed initial ranging.
     */
    public void allocateManagementConnections() {
        if (basicCid != null) {
            throw new IllegalStateException("Management connections have already been allocated");
        }
        basicCid = allocate(ConnectionType.BASIC).getCid();
        primaryCid = allocate(ConnectionType.PRIMARY).getCid();
    }

    /**
     * Allocate a new connection with the next free CID.
     *
     * @param type  Connection class (basic, primary or transport)
     *
     * @return  Newly created connection
     */
    public WimaxConnection allocate(ConnectionType type) {
        if (type == ConnectionType.INITIAL_RANGING || type == ConnectionType.BROADCAST) {
            throw new IllegalArgumentException("The " + type + " connection is unique and cannot be allocated");
        }
        if (nextCid > MAX_ALLOCATABLE_CID) {
            throw new IllegalStateException("No more connection identifiers available");
        }
        WimaxConnection connection = new WimaxConnection(nextCid++, type, new WimaxMacQueue(queueMaxSize));
        register(connection);
        return connection;
    }

    /**
     * Resolve a CID.
     *
     * @param cid   Connection identifier
     *
     * @return  Connection, or null if no connection has that CID
     */
    public WimaxConnection getConnection(int cid) {
        return connections.get(cid);
    }

    public WimaxConnection getInitialRangingConnection() {
        return connections.get(INITIAL_RANGING_CID);
    }

    /**
     * @return  Basic connection, or null if the management connections have not been allocated
     */
    public WimaxConnection getBasicConnection() {
        return basicCid == null ? null : connections.get(basicCid);
    }

    /**
     * @return  Primary connection, or null if the management connections have not been allocated
     */
    public WimaxConnection getPrimaryConnection() {
        return primaryCid == null ? null : connections.get(primaryCid);
    }

    public WimaxConnection getBroadcastConnection() {
        return connections.get(BROADCAST_CID);
    }

    /**
     * Retrieve all connections of a class, in allocation order.
     *
     * @param type  Connection class
     *
     * @return  Unmodifiable list of connections
     */
    public List<WimaxConnection> getConnections(ConnectionType type) {
        List<WimaxConnection> result = new ArrayList<>();
        for (WimaxConnection connection : connections.values()) {
            if (connection.getType() == type) {
                result.add(connection);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Check whether any connection has packets pending.
     *
     * @return  True iff at least one queue is non-empty
     */
    public boolean hasPackets() {
        for (WimaxConnection connection : connections.values()) {
            if (connection.hasPackets()) {
                return true;
            }
        }
        return false;
    }

}
