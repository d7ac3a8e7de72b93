package ch.ethz.systems.wimaxbench.core.log;

import ch.ethz.systems.wimaxbench.core.config.WBProperties;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Static logger of a single simulation run.
 *
 * All output of a run is written into its own run folder
 * (<code>run_folder_base_dir/run_folder_name</code>):
 * <ul>
 *     <li><code>config.properties</code>: the configuration the run was started with</li>
 *     <li><code>info.log</code>: key-value information lines</li>
 *     <li><code>uplink_bursts.csv.log</code>: one line per transmitted uplink burst (if enabled)</li>
 *     <li><code>statistics.log</code>: statistic counters, written at close</li>
 * </ul>
 */
public class SimulationLogger {

    // Run folder
    private static String runFolderPath = null;

    // Writers
    private static BufferedWriter writerInfo = null;
    private static BufferedWriter writerUplinkBursts = null;

    // Statistic counters (available without an open run folder)
    private static final Map<String, Long> statisticCounters = new TreeMap<>();

    private SimulationLogger() {
        // Static class only
    }

    /**
     * Open the log writers in the run folder of the given configuration.
     *
     * @param config    Run configuration
     */
    public static void open(WBProperties config) {

        String runFolderName = config.getPropertyWithDefault("run_folder_name", "default");
        String baseDir = config.getPropertyWithDefault("run_folder_base_dir", "temp");
        runFolderPath = baseDir + File.separator + runFolderName;

        File runFolder = new File(runFolderPath);
        if (!runFolder.exists() && !runFolder.mkdirs()) {
            throw new LogFailureException(new IOException("Could not create run folder: " + runFolderPath));
        }

        try {
            try (BufferedWriter writerConfig = openWriter("config.properties")) {
                writerConfig.write(config.getAllPropertiesToString());
            }
            writerInfo = openWriter("info.log");
            if (config.getBooleanPropertyWithDefault("enable_log_uplink_bursts", false)) {
                writerUplinkBursts = openWriter("uplink_bursts.csv.log");
                writerUplinkBursts.write("time_ns,cid,num_packets,size_bytes,symbols_used,symbols_available\n");
            }
        } catch (IOException e) {
            throw new LogFailureException(e);
        }

        System.out.println("Logging to run folder: " + runFolderPath);
    }

    private static BufferedWriter openWriter(String logName) throws IOException {
        return new BufferedWriter(new FileWriter(runFolderPath + File.separator + logName, StandardCharsets.UTF_8));
    }

    /**
     * Log a key-value information line. Lines logged before {@link #open(WBProperties)} are discarded.
     *
     * @param key       Key (e.g. the component or event name)
     * @param value     Value
     */
    public static void logInfo(String key, String value) {
        if (writerInfo == null) {
            return;
        }
        try {
            writerInfo.write(key + ": " + value + "\n");
        } catch (IOException e) {
            throw new LogFailureException(e);
        }
    }

    /**
     * Log a transmitted uplink burst, if burst logging is enabled.
     *
     * @param timeNs            Simulation time of the transmission
     * @param cid               Connection identifier the burst was assembled from (-1 if none)
     * @param numPackets        Number of MAC packets in the burst
     * @param sizeBytes         Total burst size in bytes
     * @param symbolsUsed       Symbols occupied by the burst
     * @param symbolsAvailable  Symbols granted for the opportunity
     */
    public static void logUplinkBurst(long timeNs, int cid, int numPackets, long sizeBytes,
                                      int symbolsUsed, int symbolsAvailable) {
        if (writerUplinkBursts == null) {
            return;
        }
        try {
            writerUplinkBursts.write(timeNs + "," + cid + "," + numPackets + "," + sizeBytes + ","
                    + symbolsUsed + "," + symbolsAvailable + "\n");
        } catch (IOException e) {
            throw new LogFailureException(e);
        }
    }

    /**
     * Increase a statistic counter by one.
     *
     * @param name  Counter name
     */
    public static void increaseStatisticCounter(String name) {
        increaseStatisticCounter(name, 1);
    }

    /**
     * Increase a statistic counter.
     *
     * @param name      Counter name
     * @param amount    Amount to add
     */
    public static void increaseStatisticCounter(String name, long amount) {
        statisticCounters.merge(name, amount, Long::sum);
    }

    /**
     * Retrieve the current value of a statistic counter.
     *
     * @param name  Counter name
     *
     * @return  Counter value (zero if never increased)
     */
    public static long getStatisticCounter(String name) {
        return statisticCounters.getOrDefault(name, 0L);
    }

    /**
     * Reset all statistic counters to zero.
     */
    public static void clearStatisticCounters() {
        statisticCounters.clear();
    }

    /**
     * @return  Path of the open run folder, or null if no run folder is open
     */
    public static String getRunFolderFull() {
        return runFolderPath;
    }

    /**
     * Write the statistics and close all writers.
     */
    public static void close() {
        if (runFolderPath != null) {
            try (BufferedWriter writerStatistics = openWriter("statistics.log")) {
                for (Map.Entry<String, Long> entry : statisticCounters.entrySet()) {
                    writerStatistics.write(entry.getKey() + ": " + entry.getValue() + "\n");
                }
            } catch (IOException e) {
                throw new LogFailureException(e);
            }
        }
        closeWriters();
        statisticCounters.clear();
        runFolderPath = null;
    }

    /**
     * Close all writers and delete the run folder (used by tests).
     */
    public static void closeAndThrowaway() {
        closeWriters();
        statisticCounters.clear();
        if (runFolderPath != null) {
            deleteRecursively(new File(runFolderPath));
        }
        runFolderPath = null;
    }

    private static void closeWriters() {
        try {
            if (writerInfo != null) {
                writerInfo.close();
            }
            if (writerUplinkBursts != null) {
                writerUplinkBursts.close();
            }
        } catch (IOException e) {
            throw new LogFailureException(e);
        } finally {
            writerInfo = null;
            writerUplinkBursts = null;
        }
    }

    private static void deleteRecursively(File file) {
        File[] children = file.listFiles();
        if (children != null) {
            for (File child : children) {
                deleteRecursively(child);
            }
        }
        if (file.exists() && !file.delete()) {
            System.err.println("Warning: could not delete " + file.getPath());
        }
    }

}
