package ch.ethz.systems.wimaxbench.xpt.wimax.mac;

/**
 * Fragmentation control of a MAC PDU.
 */
public enum FragmentState {
    NONE,
    FIRST,
    MIDDLE,
    LAST
}
