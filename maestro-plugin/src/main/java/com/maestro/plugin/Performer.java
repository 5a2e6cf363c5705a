package com.maestro.plugin;

/**
 * Contract for a performer: a unit of work hosted by a supervised worker. Implementations are loaded
 * from plugin jars (public no-arg constructor required) or registered internally.
 * <p>
 * <b>Threading:</b> a worker invokes the hooks of its instance one at a time, never concurrently.
 * Pooled performers get one instance per routee. Any exception thrown from a hook is a worker failure
 * and is handled by the supervision policy (restart in place, up to a bounded number of times).
 */
public interface Performer {

    /**
     * Called once when the instance starts (first start and after every restart), before any message.
     *
     * @param context wiring, parameters and identifiers; never null
     */
    default void onStart(PerformerContext context) throws Exception {
    }

    /**
     * Handles one message delivered to this worker.
     */
    void onMessage(Object message) throws Exception;

    /**
     * Called every {@link PerformerContext#getSchedule()} when the schedule is positive.
     */
    default void onTick() throws Exception {
    }

    /**
     * Called when the instance is stopped or replaced by a restart. Errors are logged and ignored.
     */
    default void onStop() throws Exception {
    }
}
