package com.maestro.runtime.supervision;

import com.maestro.config.MaestroConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Bounded restart policy: at most {@code maxRestarts} restarts within {@code window}, tracked per worker
 * by a {@link FailureWindow}. Also bounds full ensemble rebuilds.
 */
public final class RestartPolicy {

    public static final int DEFAULT_MAX_RESTARTS = 3;
    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(1);

    private final int maxRestarts;
    private final Duration window;
    private final LongSupplier clock;

    public RestartPolicy(int maxRestarts, Duration window) {
        this(maxRestarts, window, System::currentTimeMillis);
    }

    public RestartPolicy(int maxRestarts, Duration window, LongSupplier clock) {
        if (maxRestarts < 0) throw new IllegalArgumentException("maxRestarts must be >= 0: " + maxRestarts);
        Objects.requireNonNull(window, "window");
        if (window.isZero() || window.isNegative()) throw new IllegalArgumentException("window must be positive: " + window);
        this.maxRestarts = maxRestarts;
        this.window = window;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static RestartPolicy defaults() {
        return new RestartPolicy(DEFAULT_MAX_RESTARTS, DEFAULT_WINDOW);
    }

    public static RestartPolicy fromConfig(MaestroConfig config) {
        return new RestartPolicy(config.getMaxRestarts(), config.getRestartWindow());
    }

    public FailureWindow newWindow() {
        return new FailureWindow(maxRestarts, window.toMillis());
    }

    /** Records a failure in the window and decides. */
    public SupervisionDecision decide(FailureWindow failures) {
        return failures.recordFailure(clock.getAsLong()) ? SupervisionDecision.RESTART : SupervisionDecision.STOP;
    }

    public int getMaxRestarts() {
        return maxRestarts;
    }

    public Duration getWindow() {
        return window;
    }

    @Override
    public String toString() {
        return "RestartPolicy{maxRestarts=" + maxRestarts + ", window=" + window + "}";
    }
}
