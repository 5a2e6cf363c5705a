package com.maestro.telemetry;

/**
 * Sink that discards every event.
 */
public final class NoOpTelemetrySink implements TelemetrySink {

    @Override
    public void start(String ensembleId, long timestampMillis) {
    }

    @Override
    public void stop(String ensembleId, long timestampMillis) {
    }

    @Override
    public void restart(String ensembleId, String reason, long timestampMillis) {
    }

    @Override
    public void terminate(String ensembleId, String workerAddress, long timestampMillis) {
    }
}
