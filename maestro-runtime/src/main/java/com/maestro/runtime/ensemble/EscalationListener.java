package com.maestro.runtime.ensemble;

/**
 * Parent of ensembles. Called with the supervisor lock held, so implementations must hand the
 * rebuild off to another thread and return.
 */
@FunctionalInterface
public interface EscalationListener {

    void onRestartRequired(EnsembleRestartRequired signal);
}
