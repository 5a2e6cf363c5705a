package com.maestro.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes lifecycle events to the {@code com.maestro.telemetry} log. Terminations are logged at warn.
 */
public final class LoggingTelemetrySink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(LoggingTelemetrySink.class);

    @Override
    public void start(String ensembleId, long timestampMillis) {
        log.info("event=START ensemble={} ts={}", ensembleId, timestampMillis);
    }

    @Override
    public void stop(String ensembleId, long timestampMillis) {
        log.info("event=STOP ensemble={} ts={}", ensembleId, timestampMillis);
    }

    @Override
    public void restart(String ensembleId, String reason, long timestampMillis) {
        log.info("event=RESTART ensemble={} reason={} ts={}", ensembleId, reason, timestampMillis);
    }

    @Override
    public void terminate(String ensembleId, String workerAddress, long timestampMillis) {
        log.warn("event=TERMINATE ensemble={} worker={} ts={}", ensembleId, workerAddress, timestampMillis);
    }
}
