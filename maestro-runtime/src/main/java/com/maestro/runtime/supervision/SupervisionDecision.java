package com.maestro.runtime.supervision;

/**
 * Outcome of a worker failure: replace the performer instance in place, or let the worker die.
 */
public enum SupervisionDecision {
    RESTART,
    STOP
}
