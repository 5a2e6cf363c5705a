package com.maestro.runtime.ensemble;

/**
 * Fatal failure while materializing the workers of an ensemble. Never escapes
 * {@link EnsembleSupervisor#start}: it is turned into an {@link EnsembleRestartRequired} signal.
 */
public class EnsembleBuildException extends RuntimeException {

    private final String performerId;

    public EnsembleBuildException(String performerId, String message) {
        super(message);
        this.performerId = performerId;
    }

    public EnsembleBuildException(String performerId, String message, Throwable cause) {
        super(message, cause);
        this.performerId = performerId;
    }

    /** Performer being materialized when the build failed. */
    public String getPerformerId() {
        return performerId;
    }
}
