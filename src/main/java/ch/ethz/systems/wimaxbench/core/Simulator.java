package ch.ethz.systems.wimaxbench.core;

import ch.ethz.systems.wimaxbench.core.config.WBProperties;
import ch.ethz.systems.wimaxbench.core.log.SimulationLogger;
import ch.ethz.systems.wimaxbench.core.network.Event;

import java.util.PriorityQueue;
import java.util.Random;

/**
 * The simulator is the discrete event engine of a run. It keeps
 * the simulation clock and executes registered {@link Event events}
 * in order of their time of occurrence.
 *
 * It is a static class: a single run exists per JVM at any time, and it
 * must be {@link #setup(long, WBProperties) set up} before use and
 * {@link #reset() reset} afterwards.
 */
public class Simulator {

    // Event queue and clock
    private static PriorityQueue<Event> eventQueue = new PriorityQueue<>();
    private static long now = 0;

    // Run state
    private static WBProperties configuration = null;
    private static long seed = 0;
    private static boolean isSetup = false;
    private static long totalEventsExecuted = 0;

    private Simulator() {
        // Static class only
    }

    /**
     * Set up the simulator for a new run. Also opens the {@link SimulationLogger}.
     *
     * @param seed      Random seed of the run
     * @param config    Run configuration
     */
    public static void setup(long seed, WBProperties config) {
        if (isSetup) {
            throw new IllegalStateException("Simulator is already set up; call reset() first.");
        }
        Simulator.seed = seed;
        Simulator.configuration = config;
        Simulator.now = 0;
        Simulator.totalEventsExecuted = 0;
        Simulator.eventQueue = new PriorityQueue<>();
        isSetup = true;
        if (config != null) {
            SimulationLogger.open(config);
            SimulationLogger.logInfo("SIMULATOR_SEED", Long.toString(seed));
        }
    }

    /**
     * Register an event to be executed at its time of occurrence.
     *
     * @param event     Event instance
     */
    public static void registerEvent(Event event) {
        if (event.getTime() < now) {
            throw new IllegalArgumentException("Cannot register event in the past (event time: "
                    + event.getTime() + " ns, now: " + now + " ns)");
        }
        eventQueue.add(event);
    }

    /**
     * Run the simulation for the given amount of time. Events scheduled
     * after the end of the run remain unexecuted.
     *
     * @param runtimeNs     Running time in nanoseconds
     */
    public static void runNs(long runtimeNs) {
        if (!isSetup) {
            throw new IllegalStateException("Simulator must be set up before running.");
        }
        long endTimeNs = now + runtimeNs;
        long startRealTime = System.currentTimeMillis();

        System.out.println("Starting simulation (total time: " + runtimeNs + " ns)...");
        while (!eventQueue.isEmpty() && eventQueue.peek().getTime() <= endTimeNs) {
            Event event = eventQueue.poll();
            now = event.getTime();
            event.trigger();
            totalEventsExecuted++;
        }
        now = endTimeNs;

        long realTimeMs = System.currentTimeMillis() - startRealTime;
        System.out.println("Simulation finished (" + totalEventsExecuted + " events, " + realTimeMs + " ms real time).");
        SimulationLogger.logInfo("SIMULATION_TOTAL_EVENTS", Long.toString(totalEventsExecuted));
        SimulationLogger.logInfo("SIMULATION_REAL_TIME_MS", Long.toString(realTimeMs));
    }

    /**
     * Retrieve an independent random number generator, seeded by the run seed
     * and the name of the component that requests it.
     *
     * @param name  Name of the requesting component
     *
     * @return  Random number generator
     */
    public static Random selectIndependentRandom(String name) {
        return new Random(seed * 31 + name.hashCode());
    }

    public static long getCurrentTime() {
        return now;
    }

    public static WBProperties getConfiguration() {
        return configuration;
    }

    public static int getEventSize() {
        return eventQueue.size();
    }

    /**
     * Reset the simulator, discarding pending events, closing the logger
     * and clearing the statistic counters.
     */
    public static void reset() {
        reset(true);
    }

    /**
     * Reset the simulator.
     *
     * @param throwawayLogs     True iff the run folder must be deleted instead of finalized
     */
    public static void reset(boolean throwawayLogs) {
        if (configuration != null) {
            if (throwawayLogs) {
                SimulationLogger.closeAndThrowaway();
            } else {
                SimulationLogger.close();
            }
        }
        SimulationLogger.clearStatisticCounters();
        eventQueue = new PriorityQueue<>();
        now = 0;
        configuration = null;
        seed = 0;
        totalEventsExecuted = 0;
        isSetup = false;
        Event.staticReset();
    }

}
