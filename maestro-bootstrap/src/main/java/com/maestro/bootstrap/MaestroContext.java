package com.maestro.bootstrap;

import com.maestro.config.MaestroConfig;
import com.maestro.plugin.PluginManager;
import com.maestro.runtime.dispatch.Dispatcher;
import com.maestro.runtime.ensemble.EnsembleRuntime;
import com.maestro.telemetry.TelemetryNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Everything the process owns once bootstrapped. Closing it shuts down the orchestration, then the
 * plugin class loaders and the dispatcher threads.
 */
public final class MaestroContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaestroContext.class);

    private final MaestroConfig config;
    private final Dispatcher dispatcher;
    private final PluginManager pluginManager;
    private final TelemetryNotifier telemetry;
    private final EnsembleRuntime runtime;
    private final Orchestration orchestration;

    MaestroContext(MaestroConfig config, Dispatcher dispatcher, PluginManager pluginManager,
                   TelemetryNotifier telemetry, EnsembleRuntime runtime, Orchestration orchestration) {
        this.config = Objects.requireNonNull(config, "config");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.pluginManager = Objects.requireNonNull(pluginManager, "pluginManager");
        this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.orchestration = Objects.requireNonNull(orchestration, "orchestration");
    }

    public MaestroConfig getConfig() {
        return config;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public PluginManager getPluginManager() {
        return pluginManager;
    }

    public TelemetryNotifier getTelemetry() {
        return telemetry;
    }

    public EnsembleRuntime getRuntime() {
        return runtime;
    }

    public Orchestration getOrchestration() {
        return orchestration;
    }

    @Override
    public void close() {
        log.info("Shutting down orchestration={}", config.getOrchestrationId());
        orchestration.shutdown();
        pluginManager.close();
        dispatcher.close();
    }
}
