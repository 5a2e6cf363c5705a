package com.maestro.runtime.worker;

import com.maestro.plugin.PerformerRef;
import com.maestro.runtime.supervision.WorkerSupervisor;

/**
 * Reference to a live worker, single or pooled. Identity and address survive restarts in place.
 */
public interface WorkerHandle extends PerformerRef {

    /**
     * Fire-and-forget termination. Pending messages are dropped and logged; no-op once terminal.
     */
    void stop();

    WorkerState getState();

    /** Queued messages plus the one in flight. */
    int pendingCount();

    /** Logs the worker address (broadcast to every routee for pools). */
    void printPath();

    /** Sets the watcher that decides failures and receives the termination. */
    void watch(WorkerSupervisor supervisor);

    /** Removes the watcher; a later termination is not reported. */
    void unwatch();
}
