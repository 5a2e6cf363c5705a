package com.maestro.runtime.ensemble;

import com.maestro.config.MaestroConfig;
import com.maestro.ensemblespec.graph.GraphModelBuilder;
import com.maestro.plugin.PluginLoader;
import com.maestro.runtime.dispatch.Dispatcher;
import com.maestro.runtime.pool.PoolSettings;
import com.maestro.runtime.supervision.RestartPolicy;
import com.maestro.telemetry.TelemetryNotifier;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Collaborators shared by every ensemble of one orchestration: dispatcher, plugin loader, telemetry,
 * restart policy, pool settings, graph builder and orchestration identifiers.
 */
public final class EnsembleRuntime {

    private final Dispatcher dispatcher;
    private final PluginLoader pluginLoader;
    private final TelemetryNotifier telemetry;
    private final RestartPolicy restartPolicy;
    private final PoolSettings poolSettings;
    private final GraphModelBuilder graphModelBuilder;
    private final String orchestrationId;
    private final String orchestrationName;

    private EnsembleRuntime(Builder b) {
        this.dispatcher = Objects.requireNonNull(b.dispatcher, "dispatcher");
        this.pluginLoader = Objects.requireNonNull(b.pluginLoader, "pluginLoader");
        this.telemetry = b.telemetry != null ? b.telemetry : TelemetryNotifier.noOp();
        this.restartPolicy = b.restartPolicy != null ? b.restartPolicy : RestartPolicy.defaults();
        this.poolSettings = b.poolSettings != null ? b.poolSettings : PoolSettings.defaults();
        this.graphModelBuilder = Objects.requireNonNull(b.graphModelBuilder, "graphModelBuilder");
        this.orchestrationId = b.orchestrationId != null ? b.orchestrationId : MaestroConfig.DEFAULT_ORCHESTRATION_ID;
        this.orchestrationName = b.orchestrationName != null ? b.orchestrationName : MaestroConfig.DEFAULT_ORCHESTRATION_NAME;
    }

    public static EnsembleRuntime fromConfig(MaestroConfig config, Dispatcher dispatcher, PluginLoader pluginLoader,
                                             TelemetryNotifier telemetry) {
        return builder()
                .dispatcher(dispatcher)
                .pluginLoader(pluginLoader)
                .telemetry(telemetry)
                .restartPolicy(RestartPolicy.fromConfig(config))
                .poolSettings(PoolSettings.fromConfig(config))
                .graphModelBuilder(new GraphModelBuilder(Path.of(config.getJarRepository()),
                        Path.of(config.getDynamicJarRepository())))
                .orchestrationId(config.getOrchestrationId())
                .orchestrationName(config.getOrchestrationName())
                .build();
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public PluginLoader getPluginLoader() {
        return pluginLoader;
    }

    public TelemetryNotifier getTelemetry() {
        return telemetry;
    }

    public RestartPolicy getRestartPolicy() {
        return restartPolicy;
    }

    public PoolSettings getPoolSettings() {
        return poolSettings;
    }

    public GraphModelBuilder getGraphModelBuilder() {
        return graphModelBuilder;
    }

    public String getOrchestrationId() {
        return orchestrationId;
    }

    public String getOrchestrationName() {
        return orchestrationName;
    }

    /** {@code maestro://<orchestrationId>/<ensembleId>} */
    public String addressOf(String ensembleId) {
        return "maestro://" + orchestrationId + "/" + ensembleId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Dispatcher dispatcher;
        private PluginLoader pluginLoader;
        private TelemetryNotifier telemetry;
        private RestartPolicy restartPolicy;
        private PoolSettings poolSettings;
        private GraphModelBuilder graphModelBuilder;
        private String orchestrationId;
        private String orchestrationName;

        public Builder dispatcher(Dispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder pluginLoader(PluginLoader pluginLoader) {
            this.pluginLoader = pluginLoader;
            return this;
        }

        public Builder telemetry(TelemetryNotifier telemetry) {
            this.telemetry = telemetry;
            return this;
        }

        public Builder restartPolicy(RestartPolicy restartPolicy) {
            this.restartPolicy = restartPolicy;
            return this;
        }

        public Builder poolSettings(PoolSettings poolSettings) {
            this.poolSettings = poolSettings;
            return this;
        }

        public Builder graphModelBuilder(GraphModelBuilder graphModelBuilder) {
            this.graphModelBuilder = graphModelBuilder;
            return this;
        }

        public Builder orchestrationId(String orchestrationId) {
            this.orchestrationId = orchestrationId;
            return this;
        }

        public Builder orchestrationName(String orchestrationName) {
            this.orchestrationName = orchestrationName;
            return this;
        }

        public EnsembleRuntime build() {
            return new EnsembleRuntime(this);
        }
    }
}
