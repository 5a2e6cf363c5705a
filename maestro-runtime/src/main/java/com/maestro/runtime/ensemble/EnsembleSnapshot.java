package com.maestro.runtime.ensemble;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of an ensemble for diagnostics.
 *
 * @param edges             connections, source id → dependency ids, in declaration order
 * @param performerIds      declared performer ids
 * @param workerAddresses   addresses of live workers; empty when not running
 */
public record EnsembleSnapshot(
        String ensembleId,
        long generation,
        EnsemblePhase phase,
        Map<String, List<String>> edges,
        List<String> performerIds,
        List<String> workerAddresses
) {
    public EnsembleSnapshot {
        edges = edges != null ? edges : Map.of();
        performerIds = performerIds != null ? List.copyOf(performerIds) : List.of();
        workerAddresses = workerAddresses != null ? List.copyOf(workerAddresses) : List.of();
    }
}
