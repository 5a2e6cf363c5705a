package com.maestro.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the Maestro ensemble runtime.
 * <p>
 * Jar repositories: MAESTRO_JAR_REPOSITORY (static, for performers without an explicit source location)
 * and MAESTRO_DYNAMIC_JAR_REPOSITORY (for performers whose source declares a location).
 * <p>
 * Supervision: MAESTRO_MAX_RESTARTS within MAESTRO_RESTART_WINDOW_SECONDS. Pools: MAESTRO_MESSAGES_PER_RESIZE,
 * MAESTRO_MAILBOX_CAPACITY, MAESTRO_BACKLOG_THRESHOLD, MAESTRO_BACKOFF_THRESHOLD.
 */
public final class MaestroConfig {

    private static final String ENV_JAR_REPOSITORY = "MAESTRO_JAR_REPOSITORY";
    private static final String ENV_DYNAMIC_JAR_REPOSITORY = "MAESTRO_DYNAMIC_JAR_REPOSITORY";
    private static final String ENV_ENSEMBLE_DIR = "MAESTRO_ENSEMBLE_DIR";
    private static final String ENV_ORCHESTRATION_ID = "MAESTRO_ORCHESTRATION_ID";
    private static final String ENV_ORCHESTRATION_NAME = "MAESTRO_ORCHESTRATION_NAME";
    private static final String ENV_MAX_RESTARTS = "MAESTRO_MAX_RESTARTS";
    private static final String ENV_RESTART_WINDOW_SECONDS = "MAESTRO_RESTART_WINDOW_SECONDS";
    private static final String ENV_MESSAGES_PER_RESIZE = "MAESTRO_MESSAGES_PER_RESIZE";
    private static final String ENV_MAILBOX_CAPACITY = "MAESTRO_MAILBOX_CAPACITY";
    private static final String ENV_BACKLOG_THRESHOLD = "MAESTRO_BACKLOG_THRESHOLD";
    private static final String ENV_BACKOFF_THRESHOLD = "MAESTRO_BACKOFF_THRESHOLD";
    private static final String ENV_WORKER_THREADS = "MAESTRO_WORKER_THREADS";
    private static final String ENV_CONTROL_THREADS = "MAESTRO_CONTROL_THREADS";
    private static final String ENV_DISPATCH_THROUGHPUT = "MAESTRO_DISPATCH_THROUGHPUT";
    private static final String ENV_METRICS_ENABLED = "MAESTRO_METRICS_ENABLED";

    private static final String DEFAULT_JAR_REPOSITORY = "/opt/maestro/jars";
    private static final String DEFAULT_DYNAMIC_JAR_REPOSITORY = "/opt/maestro/dynamic-jars";
    private static final String DEFAULT_ENSEMBLE_DIR = "ensembles";
    public static final String DEFAULT_ORCHESTRATION_ID = "default";
    public static final String DEFAULT_ORCHESTRATION_NAME = "maestro";
    private static final int DEFAULT_MAX_RESTARTS = 3;
    private static final int DEFAULT_RESTART_WINDOW_SECONDS = 60;
    private static final int DEFAULT_MESSAGES_PER_RESIZE = 500;
    private static final int DEFAULT_MAILBOX_CAPACITY = 50;
    private static final double DEFAULT_BACKLOG_THRESHOLD = 0.4;
    private static final double DEFAULT_BACKOFF_THRESHOLD = 0.1;
    private static final int DEFAULT_CONTROL_THREADS = 2;
    private static final int DEFAULT_DISPATCH_THROUGHPUT = 10;

    private final String jarRepository;
    private final String dynamicJarRepository;
    private final String ensembleDir;
    private final String orchestrationId;
    private final String orchestrationName;
    private final int maxRestarts;
    private final Duration restartWindow;
    private final int messagesPerResize;
    private final int mailboxCapacity;
    private final double backlogThreshold;
    private final double backoffThreshold;
    private final int workerThreads;
    private final int controlThreads;
    private final int dispatchThroughput;
    private final boolean metricsEnabled;

    private MaestroConfig(Builder b) {
        this.jarRepository = b.jarRepository;
        this.dynamicJarRepository = b.dynamicJarRepository;
        this.ensembleDir = b.ensembleDir;
        this.orchestrationId = b.orchestrationId;
        this.orchestrationName = b.orchestrationName;
        this.maxRestarts = b.maxRestarts;
        this.restartWindow = b.restartWindow;
        this.messagesPerResize = b.messagesPerResize;
        this.mailboxCapacity = b.mailboxCapacity;
        this.backlogThreshold = b.backlogThreshold;
        this.backoffThreshold = b.backoffThreshold;
        this.workerThreads = b.workerThreads;
        this.controlThreads = b.controlThreads;
        this.dispatchThroughput = b.dispatchThroughput;
        this.metricsEnabled = b.metricsEnabled;
    }

    /** Static jar repository root (performers whose source has no explicit location). */
    public String getJarRepository() {
        return jarRepository;
    }

    /** Dynamic jar repository root (performers whose source declares a location). */
    public String getDynamicJarRepository() {
        return dynamicJarRepository;
    }

    /** Directory scanned for ensemble JSON files at bootstrap. Default {@code ensembles}. */
    public String getEnsembleDir() {
        return ensembleDir;
    }

    public String getOrchestrationId() {
        return orchestrationId;
    }

    public String getOrchestrationName() {
        return orchestrationName;
    }

    /** Restarts allowed per worker within {@link #getRestartWindow()} before it is declared dead. Default 3. */
    public int getMaxRestarts() {
        return maxRestarts;
    }

    /** Sliding window for {@link #getMaxRestarts()}. Default one minute. */
    public Duration getRestartWindow() {
        return restartWindow;
    }

    /** Number of dispatched messages between two pool resize evaluations. Default 500. */
    public int getMessagesPerResize() {
        return messagesPerResize;
    }

    /** Nominal mailbox capacity used to compute routee backlog. Default 50. */
    public int getMailboxCapacity() {
        return mailboxCapacity;
    }

    /**
     * Fraction of capacity above which a routee counts as pressured, and fraction of pressured
     * routees above which the pool grows. Default 0.4.
     */
    public double getBacklogThreshold() {
        return backlogThreshold;
    }

    /** Fraction of pressured routees below which the pool shrinks. Default 0.1. */
    public double getBackoffThreshold() {
        return backoffThreshold;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getControlThreads() {
        return controlThreads;
    }

    /** Messages a worker processes per scheduling turn before yielding its thread. Default 10. */
    public int getDispatchThroughput() {
        return dispatchThroughput;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public static MaestroConfig fromEnvironment() {
        return builder()
                .jarRepository(getEnv(ENV_JAR_REPOSITORY, DEFAULT_JAR_REPOSITORY))
                .dynamicJarRepository(getEnv(ENV_DYNAMIC_JAR_REPOSITORY, DEFAULT_DYNAMIC_JAR_REPOSITORY))
                .ensembleDir(getEnv(ENV_ENSEMBLE_DIR, DEFAULT_ENSEMBLE_DIR))
                .orchestrationId(getEnv(ENV_ORCHESTRATION_ID, DEFAULT_ORCHESTRATION_ID))
                .orchestrationName(getEnv(ENV_ORCHESTRATION_NAME, DEFAULT_ORCHESTRATION_NAME))
                .maxRestarts(parseInt(System.getenv(ENV_MAX_RESTARTS), DEFAULT_MAX_RESTARTS))
                .restartWindow(Duration.ofSeconds(parseInt(System.getenv(ENV_RESTART_WINDOW_SECONDS), DEFAULT_RESTART_WINDOW_SECONDS)))
                .messagesPerResize(parseInt(System.getenv(ENV_MESSAGES_PER_RESIZE), DEFAULT_MESSAGES_PER_RESIZE))
                .mailboxCapacity(parseInt(System.getenv(ENV_MAILBOX_CAPACITY), DEFAULT_MAILBOX_CAPACITY))
                .backlogThreshold(parseDouble(System.getenv(ENV_BACKLOG_THRESHOLD), DEFAULT_BACKLOG_THRESHOLD))
                .backoffThreshold(parseDouble(System.getenv(ENV_BACKOFF_THRESHOLD), DEFAULT_BACKOFF_THRESHOLD))
                .workerThreads(parseInt(System.getenv(ENV_WORKER_THREADS), defaultWorkerThreads()))
                .controlThreads(parseInt(System.getenv(ENV_CONTROL_THREADS), DEFAULT_CONTROL_THREADS))
                .dispatchThroughput(parseInt(System.getenv(ENV_DISPATCH_THROUGHPUT), DEFAULT_DISPATCH_THROUGHPUT))
                .metricsEnabled(parseBoolean(System.getenv(ENV_METRICS_ENABLED), true))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int defaultWorkerThreads() {
        return Math.max(2, Runtime.getRuntime().availableProcessors());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static double parseDouble(String value, double defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(String key, String defaultValue) {
        String v = System.getenv(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String jarRepository = DEFAULT_JAR_REPOSITORY;
        private String dynamicJarRepository = DEFAULT_DYNAMIC_JAR_REPOSITORY;
        private String ensembleDir = DEFAULT_ENSEMBLE_DIR;
        private String orchestrationId = DEFAULT_ORCHESTRATION_ID;
        private String orchestrationName = DEFAULT_ORCHESTRATION_NAME;
        private int maxRestarts = DEFAULT_MAX_RESTARTS;
        private Duration restartWindow = Duration.ofSeconds(DEFAULT_RESTART_WINDOW_SECONDS);
        private int messagesPerResize = DEFAULT_MESSAGES_PER_RESIZE;
        private int mailboxCapacity = DEFAULT_MAILBOX_CAPACITY;
        private double backlogThreshold = DEFAULT_BACKLOG_THRESHOLD;
        private double backoffThreshold = DEFAULT_BACKOFF_THRESHOLD;
        private int workerThreads = defaultWorkerThreads();
        private int controlThreads = DEFAULT_CONTROL_THREADS;
        private int dispatchThroughput = DEFAULT_DISPATCH_THROUGHPUT;
        private boolean metricsEnabled = true;

        public Builder jarRepository(String jarRepository) {
            this.jarRepository = jarRepository != null ? jarRepository : DEFAULT_JAR_REPOSITORY;
            return this;
        }

        public Builder dynamicJarRepository(String dynamicJarRepository) {
            this.dynamicJarRepository = dynamicJarRepository != null ? dynamicJarRepository : DEFAULT_DYNAMIC_JAR_REPOSITORY;
            return this;
        }

        public Builder ensembleDir(String ensembleDir) {
            this.ensembleDir = ensembleDir != null ? ensembleDir : DEFAULT_ENSEMBLE_DIR;
            return this;
        }

        public Builder orchestrationId(String orchestrationId) {
            this.orchestrationId = orchestrationId != null ? orchestrationId : DEFAULT_ORCHESTRATION_ID;
            return this;
        }

        public Builder orchestrationName(String orchestrationName) {
            this.orchestrationName = orchestrationName != null ? orchestrationName : DEFAULT_ORCHESTRATION_NAME;
            return this;
        }

        public Builder maxRestarts(int maxRestarts) {
            this.maxRestarts = maxRestarts;
            return this;
        }

        public Builder restartWindow(Duration restartWindow) {
            this.restartWindow = Objects.requireNonNull(restartWindow, "restartWindow");
            return this;
        }

        public Builder messagesPerResize(int messagesPerResize) {
            this.messagesPerResize = messagesPerResize;
            return this;
        }

        public Builder mailboxCapacity(int mailboxCapacity) {
            this.mailboxCapacity = mailboxCapacity;
            return this;
        }

        public Builder backlogThreshold(double backlogThreshold) {
            this.backlogThreshold = backlogThreshold;
            return this;
        }

        public Builder backoffThreshold(double backoffThreshold) {
            this.backoffThreshold = backoffThreshold;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder controlThreads(int controlThreads) {
            this.controlThreads = controlThreads;
            return this;
        }

        public Builder dispatchThroughput(int dispatchThroughput) {
            this.dispatchThroughput = dispatchThroughput;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a numeric setting is out of range
         */
        public MaestroConfig build() {
            requirePositive("maxRestarts", maxRestarts, 0);
            requirePositive("messagesPerResize", messagesPerResize, 1);
            requirePositive("mailboxCapacity", mailboxCapacity, 1);
            requirePositive("workerThreads", workerThreads, 1);
            requirePositive("controlThreads", controlThreads, 1);
            requirePositive("dispatchThroughput", dispatchThroughput, 1);
            if (restartWindow.isNegative() || restartWindow.isZero()) {
                throw new IllegalArgumentException("restartWindow must be positive: " + restartWindow);
            }
            if (backlogThreshold <= 0 || backlogThreshold > 1) {
                throw new IllegalArgumentException("backlogThreshold must be in (0, 1]: " + backlogThreshold);
            }
            if (backoffThreshold < 0 || backoffThreshold >= backlogThreshold) {
                throw new IllegalArgumentException("backoffThreshold must be in [0, backlogThreshold): " + backoffThreshold);
            }
            return new MaestroConfig(this);
        }

        private static void requirePositive(String name, int value, int min) {
            if (value < min) {
                throw new IllegalArgumentException(name + " must be >= " + min + ": " + value);
            }
        }
    }
}
