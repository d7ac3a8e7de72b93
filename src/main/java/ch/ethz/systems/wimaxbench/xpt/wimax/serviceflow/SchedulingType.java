package ch.ethz.systems.wimaxbench.xpt.wimax.serviceflow;

/**
 * QoS scheduling service of a service flow, in descending uplink scheduling priority.
 */
public enum SchedulingType {

    /**
     * Unsolicited grant service: fixed-size grants at a fixed grant interval.
     */
    UGS,

    /**
     * Real-time polling service: polled at a fixed polling interval.
     */
    RTPS,

    /**
     * Non-real-time polling service: served whenever polled, no timing constraint.
     */
    NRTPS,

    /**
     * Best effort: lowest priority traffic.
     */
    BE;

    /**
     * Parse a scheduling type from its configuration name (case-insensitive).
     *
     * @param name  Name, e.g. "ugs" or "rtps"
     *
     * @return  Scheduling type
     */
    public static SchedulingType fromName(String name) {
        switch (name.trim().toLowerCase()) {
            case "ugs":
                return UGS;
            case "rtps":
                return RTPS;
            case "nrtps":
                return NRTPS;
            case "be":
                return BE;
            default:
                throw new IllegalArgumentException(
                    "Invalid scheduling type: " + name +
                    ". Must be one of: ugs, rtps, nrtps, be"
                );
        }
    }

}
