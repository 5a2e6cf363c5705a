package com.maestro.telemetry;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts lifecycle events in a Micrometer registry:
 * {@code maestro.ensemble.events} tagged {@code ensemble} and {@code event}, plus a
 * {@code maestro.ensemble.last.event} gauge holding the timestamp of the most recent event.
 * Worker addresses are not used as tags to keep cardinality bounded.
 */
public final class MicrometerTelemetrySink implements TelemetrySink {

    public static final String EVENTS_METER = "maestro.ensemble.events";
    public static final String LAST_EVENT_GAUGE = "maestro.ensemble.last.event";

    private final MeterRegistry registry;
    private final AtomicLong lastEventMillis = new AtomicLong();

    public MicrometerTelemetrySink() {
        this(new SimpleMeterRegistry());
    }

    public MicrometerTelemetrySink(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        registry.gauge(LAST_EVENT_GAUGE, lastEventMillis);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void start(String ensembleId, long timestampMillis) {
        record(ensembleId, "start", timestampMillis);
    }

    @Override
    public void stop(String ensembleId, long timestampMillis) {
        record(ensembleId, "stop", timestampMillis);
    }

    @Override
    public void restart(String ensembleId, String reason, long timestampMillis) {
        record(ensembleId, "restart", timestampMillis);
    }

    @Override
    public void terminate(String ensembleId, String workerAddress, long timestampMillis) {
        record(ensembleId, "terminate", timestampMillis);
    }

    private void record(String ensembleId, String event, long timestampMillis) {
        registry.counter(EVENTS_METER,
                "ensemble", ensembleId != null ? ensembleId : "unknown",
                "event", event
        ).increment();
        lastEventMillis.accumulateAndGet(timestampMillis, Math::max);
    }
}
