package ch.ethz.systems.wimaxbench.xpt.wimax.connection;

/**
 * Classes of MAC connections a subscriber station holds.
 */
public enum ConnectionType {

    /**
     * Initial ranging connection, used before the station has been admitted.
     */
    INITIAL_RANGING,

    /**
     * Basic management connection (short, time-urgent management messages).
     */
    BASIC,

    /**
     * Primary management connection (longer, delay-tolerant management messages).
     */
    PRIMARY,

    /**
     * Transport connection carrying the data of one service flow.
     */
    TRANSPORT,

    /**
     * Broadcast connection.
     */
    BROADCAST;

    /**
     * Whether packets of this connection class may be sent in fragments.
     * Only transport connections carry a fragmentable payload.
     *
     * @return  True iff fragmentation is allowed
     */
    public boolean isFragmentable() {
        switch (this) {
            case TRANSPORT:
                return true;
            case INITIAL_RANGING:
            case BASIC:
            case PRIMARY:
            case BROADCAST:
                return false;
            default:
                throw new IllegalStateException("Unhandled connection type: " + this);
        }
    }

}
