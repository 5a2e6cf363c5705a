package com.maestro.telemetry;

/**
 * Receives ensemble lifecycle events. Fire-and-forget: implementations must not block the caller
 * for long. Callers go through {@link TelemetryNotifier}, which isolates sink failures.
 * Timestamps are epoch milliseconds.
 */
public interface TelemetrySink {

    /** The ensemble has begun building its workers. */
    void start(String ensembleId, long timestampMillis);

    /** The ensemble was stopped on request. */
    void stop(String ensembleId, long timestampMillis);

    /** The ensemble is being rebuilt from its specification. */
    void restart(String ensembleId, String reason, long timestampMillis);

    /** A worker of the ensemble terminated unexpectedly. */
    void terminate(String ensembleId, String workerAddress, long timestampMillis);
}
