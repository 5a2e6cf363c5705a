package com.maestro.runtime.ensemble;

/**
 * A connection references a performer id that has no performer definition.
 */
public final class UnknownPerformerException extends EnsembleBuildException {

    public UnknownPerformerException(String performerId) {
        super(performerId, "Performer " + performerId + " is not defined in the ensemble specification");
    }
}
