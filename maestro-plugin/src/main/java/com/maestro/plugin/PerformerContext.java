package com.maestro.plugin;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable wiring handed to {@link Performer#onStart(PerformerContext)}: parameters, schedule and backoff,
 * connections to dependency workers, identifiers and the performer's own reference.
 * Connections keep the declared dependency order.
 */
public final class PerformerContext {

    private final String performerId;
    private final Map<String, String> parameters;
    private final Duration schedule;
    private final Duration backoff;
    private final Map<String, PerformerRef> connections;
    private final String ensembleId;
    private final String orchestrationId;
    private final String orchestrationName;
    private final boolean autoScaled;
    private final PerformerRef self;

    private PerformerContext(Builder b) {
        this.performerId = Objects.requireNonNull(b.performerId, "performerId");
        this.parameters = b.parameters != null ? Map.copyOf(b.parameters) : Map.of();
        this.schedule = b.schedule != null ? b.schedule : Duration.ZERO;
        this.backoff = b.backoff != null ? b.backoff : Duration.ZERO;
        this.connections = b.connections != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(b.connections))
                : Map.of();
        this.ensembleId = b.ensembleId;
        this.orchestrationId = b.orchestrationId;
        this.orchestrationName = b.orchestrationName;
        this.autoScaled = b.autoScaled;
        this.self = b.self;
    }

    public String getPerformerId() {
        return performerId;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    /** Parameter value, or null if absent. */
    public String getParameter(String key) {
        return parameters.get(key);
    }

    /** Tick interval; zero means no ticks. */
    public Duration getSchedule() {
        return schedule;
    }

    /** Backoff interval the performer applies between units of work. */
    public Duration getBackoff() {
        return backoff;
    }

    /** Dependency workers keyed by performer id. */
    public Map<String, PerformerRef> getConnections() {
        return connections;
    }

    public String getEnsembleId() {
        return ensembleId;
    }

    public String getOrchestrationId() {
        return orchestrationId;
    }

    public String getOrchestrationName() {
        return orchestrationName;
    }

    /** True when this performer runs as one routee of an elastic pool. */
    public boolean isAutoScaled() {
        return autoScaled;
    }

    /** Reference to the worker hosting this performer; null until bound by the worker. */
    public PerformerRef self() {
        return self;
    }

    /**
     * Sends the message to every connection.
     *
     * @return number of connections that accepted it
     */
    public int propagate(Object message) {
        int accepted = 0;
        for (PerformerRef ref : connections.values()) {
            if (ref.tell(message)) accepted++;
        }
        return accepted;
    }

    /** Copy of this context bound to the given worker reference. */
    public PerformerContext withSelf(PerformerRef self) {
        return toBuilder().self(self).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .performerId(performerId)
                .parameters(parameters)
                .schedule(schedule)
                .backoff(backoff)
                .connections(connections)
                .ensembleId(ensembleId)
                .orchestrationId(orchestrationId)
                .orchestrationName(orchestrationName)
                .autoScaled(autoScaled)
                .self(self);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "PerformerContext{performerId='" + performerId + "', ensembleId='" + ensembleId
                + "', connections=" + connections.keySet() + ", schedule=" + schedule
                + ", autoScaled=" + autoScaled + "}";
    }

    public static final class Builder {
        private String performerId;
        private Map<String, String> parameters;
        private Duration schedule;
        private Duration backoff;
        private Map<String, PerformerRef> connections;
        private String ensembleId;
        private String orchestrationId;
        private String orchestrationName;
        private boolean autoScaled;
        private PerformerRef self;

        public Builder performerId(String performerId) {
            this.performerId = performerId;
            return this;
        }

        public Builder parameters(Map<String, String> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder schedule(Duration schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder backoff(Duration backoff) {
            this.backoff = backoff;
            return this;
        }

        public Builder connections(Map<String, PerformerRef> connections) {
            this.connections = connections;
            return this;
        }

        public Builder ensembleId(String ensembleId) {
            this.ensembleId = ensembleId;
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

        public Builder autoScaled(boolean autoScaled) {
            this.autoScaled = autoScaled;
            return this;
        }

        public Builder self(PerformerRef self) {
            this.self = self;
            return this;
        }

        public PerformerContext build() {
            return new PerformerContext(this);
        }
    }
}
