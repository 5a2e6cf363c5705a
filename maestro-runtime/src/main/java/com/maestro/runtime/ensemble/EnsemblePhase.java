package com.maestro.runtime.ensemble;

/**
 * NEW → BUILDING → RUNNING → ESCALATING → TORN_DOWN; STOPPED after an explicit stop.
 * A failed build goes from BUILDING straight to TORN_DOWN; a rebuild re-enters BUILDING.
 */
public enum EnsemblePhase {
    NEW,
    BUILDING,
    RUNNING,
    ESCALATING,
    TORN_DOWN,
    STOPPED
}
