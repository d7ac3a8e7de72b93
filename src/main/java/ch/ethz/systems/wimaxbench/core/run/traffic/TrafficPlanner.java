package ch.ethz.systems.wimaxbench.core.run.traffic;

/**
 * A traffic planner registers the arrival events of all traffic of a run
 * before the simulation starts.
 */
public abstract class TrafficPlanner {

    /**
     * Create the traffic plan and register its events with the simulator.
     *
     * @param durationNs    Duration of the run in nanoseconds
     */
    public abstract void createPlan(long durationNs);

}
