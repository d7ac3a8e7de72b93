package ch.ethz.systems.wimaxbench.core.network;

import ch.ethz.systems.wimaxbench.core.Simulator;

/**
 * Discrete event which is executed by the {@link Simulator} once
 * the simulation time reaches its time of occurrence.
 *
 * Events with the same time are executed in the order in which they
 * were created.
 */
public abstract class Event implements Comparable<Event> {

    // Tie-breaker for events that occur at the same time
    private static long eventIdCounter = 0;

    private final long eventId;
    private final long timeNs;

    /**
     * Create event which will happen the given amount of nanoseconds later.
     *
     * @param timeFromNowNs     Time it will take before happening from now in nanoseconds
     */
    public Event(long timeFromNowNs) {
        if (timeFromNowNs < 0) {
            throw new IllegalArgumentException("Event cannot be scheduled in the past (time from now: " + timeFromNowNs + " ns)");
        }
        this.eventId = eventIdCounter++;
        this.timeNs = Simulator.getCurrentTime() + timeFromNowNs;
    }

    /**
     * Get the absolute simulation time at which the event occurs.
     *
     * @return  Time of occurrence in nanoseconds
     */
    public long getTime() {
        return timeNs;
    }

    /**
     * Execute the event.
     */
    public abstract void trigger();

    @Override
    public int compareTo(Event other) {
        int byTime = Long.compare(this.timeNs, other.timeNs);
        return byTime != 0 ? byTime : Long.compare(this.eventId, other.eventId);
    }

    /**
     * Reset the static run state.
     */
    public static void staticReset() {
        eventIdCounter = 0;
    }

}
