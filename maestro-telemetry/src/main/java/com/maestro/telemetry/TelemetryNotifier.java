package com.maestro.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongSupplier;

/**
 * Fail-safe facade for a {@link TelemetrySink}. Stamps each event with the current time and delegates;
 * any exception from the sink is caught, logged, and not rethrown so supervision never fails on telemetry.
 */
public final class TelemetryNotifier {

    private static final Logger log = LoggerFactory.getLogger(TelemetryNotifier.class);

    private final TelemetrySink sink;
    private final LongSupplier clock;

    public TelemetryNotifier(TelemetrySink sink) {
        this(sink, System::currentTimeMillis);
    }

    public TelemetryNotifier(TelemetrySink sink, LongSupplier clock) {
        this.sink = sink != null ? sink : new NoOpTelemetrySink();
        this.clock = clock != null ? clock : System::currentTimeMillis;
    }

    public static TelemetryNotifier noOp() {
        return new TelemetryNotifier(new NoOpTelemetrySink());
    }

    public void start(String ensembleId) {
        try {
            sink.start(ensembleId, clock.getAsLong());
        } catch (Throwable t) {
            log.warn("Telemetry start failed (ensemble={}); execution continues. Error: {}", ensembleId, t.getMessage(), t);
        }
    }

    public void stop(String ensembleId) {
        try {
            sink.stop(ensembleId, clock.getAsLong());
        } catch (Throwable t) {
            log.warn("Telemetry stop failed (ensemble={}); execution continues. Error: {}", ensembleId, t.getMessage(), t);
        }
    }

    public void restart(String ensembleId, String reason) {
        try {
            sink.restart(ensembleId, reason, clock.getAsLong());
        } catch (Throwable t) {
            log.warn("Telemetry restart failed (ensemble={}); execution continues. Error: {}", ensembleId, t.getMessage(), t);
        }
    }

    public void terminate(String ensembleId, String workerAddress) {
        try {
            sink.terminate(ensembleId, workerAddress, clock.getAsLong());
        } catch (Throwable t) {
            log.warn("Telemetry terminate failed (ensemble={}, worker={}); execution continues. Error: {}",
                    ensembleId, workerAddress, t.getMessage(), t);
        }
    }
}
