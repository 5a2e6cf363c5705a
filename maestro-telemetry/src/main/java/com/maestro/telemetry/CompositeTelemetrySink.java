package com.maestro.telemetry;

import java.util.List;

/**
 * Forwards every event to each delegate in order. A failing delegate stops the fan-out;
 * wrap the composite in a {@link TelemetryNotifier} to isolate failures.
 */
public final class CompositeTelemetrySink implements TelemetrySink {

    private final List<TelemetrySink> delegates;

    public CompositeTelemetrySink(List<TelemetrySink> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public List<TelemetrySink> getDelegates() {
        return delegates;
    }

    @Override
    public void start(String ensembleId, long timestampMillis) {
        for (TelemetrySink s : delegates) s.start(ensembleId, timestampMillis);
    }

    @Override
    public void stop(String ensembleId, long timestampMillis) {
        for (TelemetrySink s : delegates) s.stop(ensembleId, timestampMillis);
    }

    @Override
    public void restart(String ensembleId, String reason, long timestampMillis) {
        for (TelemetrySink s : delegates) s.restart(ensembleId, reason, timestampMillis);
    }

    @Override
    public void terminate(String ensembleId, String workerAddress, long timestampMillis) {
        for (TelemetrySink s : delegates) s.terminate(ensembleId, workerAddress, timestampMillis);
    }
}
