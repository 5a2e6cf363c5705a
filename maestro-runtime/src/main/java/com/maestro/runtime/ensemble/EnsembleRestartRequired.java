package com.maestro.runtime.ensemble;

import java.util.Optional;

/**
 * Signal to the parent that an ensemble was torn down and must be rebuilt from its specification.
 *
 * @param generation         generation that failed
 * @param deadWorkerAddress  address of the worker whose death caused it; null for build failures
 * @param cause              underlying failure, may be null
 */
public record EnsembleRestartRequired(
        String ensembleId,
        long generation,
        String reason,
        String deadWorkerAddress,
        Throwable cause,
        long timestampMillis
) {
    public Optional<String> deadWorker() {
        return Optional.ofNullable(deadWorkerAddress);
    }

    public Optional<Throwable> failure() {
        return Optional.ofNullable(cause);
    }
}
