package com.maestro.plugin;

/**
 * Reference to a live worker as seen by performers: the target of connections and of {@code self()}.
 */
public interface PerformerRef {

    /** Performer id from the ensemble specification. */
    String getId();

    /** Unique address, {@code maestro://<orchestrationId>/<ensembleId>/<performerId>}. */
    String getAddress();

    /**
     * Asynchronous, non-blocking send. Returns false when the worker no longer accepts messages.
     */
    boolean tell(Object message);
}
