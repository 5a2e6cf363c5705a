package com.maestro.runtime.supervision;

import com.maestro.runtime.worker.WorkerHandle;

/**
 * Watcher of workers. Failure decisions are requested from the failing worker's thread;
 * terminations are reported once, after the worker reached a terminal state.
 */
public interface WorkerSupervisor {

    /**
     * Decides how the worker handles an exception thrown by one of its performer hooks.
     */
    SupervisionDecision onFailure(WorkerHandle worker, Throwable cause);

    /**
     * The watched worker terminated: stopped, or dead after the restart budget ran out.
     */
    void onTerminated(WorkerHandle worker, TerminationCause cause);
}
