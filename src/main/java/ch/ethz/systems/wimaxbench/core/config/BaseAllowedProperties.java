package ch.ethz.systems.wimaxbench.core.config;

public class BaseAllowedProperties {

    private BaseAllowedProperties() {
        // Private constructor, cannot be constructed
    }

    public static final String[] LOG = new String[]{
            "enable_log_uplink_bursts",
            "enable_log_scheduler_decisions",
            "enable_log_mac_queue_internal",
    };

    public static final String[] PROPERTIES_RUN = new String[] {

            // General
            "seed",
            "run_time_s",
            "run_time_ns",
            "run_folder_name",
            "run_folder_base_dir",

            // Traffic
            "traffic",
            "traffic_lambda_packet_per_s",
            "traffic_packet_size_bytes",
            "traffic_ugs_packet_size_bytes",
            "traffic_management_lambda_packet_per_s",
            "traffic_management_packet_size_bytes",

    };

    public static final String[] WIMAX = new String[]{
            // PHY
            "wimax_phy",
            "wimax_modulation",
            "wimax_frame_duration_ns",
            "wimax_uplink_symbols_per_frame",

            // MAC
            "wimax_mac_queue_max_size",

            // Service flows, e.g. "UGS,RTPS,NRTPS,BE"
            "wimax_service_flows",
            "wimax_ugs_grant_interval_ms",
            "wimax_rtps_polling_interval_ms",
    };

}
