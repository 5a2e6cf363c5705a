package com.maestro.bootstrap;

import com.maestro.config.MaestroConfig;
import com.maestro.ensemblespec.load.EnsembleSpecLoader;
import com.maestro.ensemblespec.model.EnsembleDefinition;
import com.maestro.plugin.PluginManager;
import com.maestro.runtime.dispatch.Dispatcher;
import com.maestro.runtime.ensemble.BuildOutcome;
import com.maestro.runtime.ensemble.EnsembleRuntime;
import com.maestro.runtime.supervision.RestartPolicy;
import com.maestro.telemetry.CompositeTelemetrySink;
import com.maestro.telemetry.LoggingTelemetrySink;
import com.maestro.telemetry.MicrometerTelemetrySink;
import com.maestro.telemetry.TelemetryNotifier;
import com.maestro.telemetry.TelemetrySink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point. Configuration comes from the environment ({@code MAESTRO_*}); every
 * {@code *.json} ensemble in {@code MAESTRO_ENSEMBLE_DIR} is started under one orchestration.
 * <p>
 * Ensembles start immediately; the main thread is then blocked so the JVM stays alive. The shutdown
 * hook stops every ensemble and releases threads and class loaders (e.g. Ctrl+C).
 */
public final class MaestroBootstrap {

    private static final Logger log = LoggerFactory.getLogger(MaestroBootstrap.class);

    private MaestroBootstrap() {
    }

    public static void main(String[] args) {
        log.info("Bootstrap: loading configuration from environment");
        MaestroConfig config = MaestroConfig.fromEnvironment();
        Path ensembleDir = Path.of(config.getEnsembleDir());
        List<EnsembleDefinition> definitions = new EnsembleSpecLoader(ensembleDir).loadAll();
        if (definitions.isEmpty()) {
            log.error("No ensemble specifications found in {}. Set MAESTRO_ENSEMBLE_DIR to a directory of *.json ensembles",
                    ensembleDir.toAbsolutePath());
            System.exit(1);
        }

        MaestroContext context = initialize(config);
        startAll(context, definitions);

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            context.close();
            stopped.countDown();
        }, "maestro-shutdown"));
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Main thread interrupted; shutting down");
            context.close();
        }
    }

    /**
     * Creates the dispatcher, plugin manager, telemetry and orchestration described by the configuration.
     */
    public static MaestroContext initialize(MaestroConfig config) {
        log.info("Bootstrap: orchestration={} ({}), jarRepository={}, dynamicJarRepository={}, restarts={} per {}",
                config.getOrchestrationId(), config.getOrchestrationName(), config.getJarRepository(),
                config.getDynamicJarRepository(), config.getMaxRestarts(), config.getRestartWindow());
        Dispatcher dispatcher = Dispatcher.fromConfig(config);
        PluginManager pluginManager = InternalPerformers.createPluginManager();
        TelemetryNotifier telemetry = new TelemetryNotifier(createTelemetrySink(config));
        EnsembleRuntime runtime = EnsembleRuntime.fromConfig(config, dispatcher, pluginManager, telemetry);
        Orchestration orchestration = new Orchestration(runtime, RestartPolicy.fromConfig(config));
        return new MaestroContext(config, dispatcher, pluginManager, telemetry, runtime, orchestration);
    }

    /**
     * Starts every definition. A failed build is logged and left to the orchestration's rebuilds.
     *
     * @return number of ensembles built successfully on the first attempt
     */
    public static int startAll(MaestroContext context, List<EnsembleDefinition> definitions) {
        int running = 0;
        for (EnsembleDefinition definition : definitions) {
            try {
                BuildOutcome outcome = context.getOrchestration().createEnsemble(definition);
                if (outcome.isSuccess()) {
                    running++;
                } else {
                    log.error("Ensemble {} failed to build: {}", definition.getGuid(),
                            outcome.getSignal().map(s -> s.reason()).orElse("unknown"));
                }
            } catch (IllegalArgumentException | IllegalStateException e) {
                log.error("Skipping ensemble {}: {}", definition.getGuid(), e.getMessage());
            }
        }
        log.info("Bootstrap: {} of {} ensemble(s) running in orchestration={}",
                running, definitions.size(), context.getConfig().getOrchestrationId());
        return running;
    }

    static TelemetrySink createTelemetrySink(MaestroConfig config) {
        List<TelemetrySink> sinks = new ArrayList<>();
        sinks.add(new LoggingTelemetrySink());
        if (config.isMetricsEnabled()) {
            sinks.add(new MicrometerTelemetrySink(new SimpleMeterRegistry()));
        }
        return new CompositeTelemetrySink(sinks);
    }
}
