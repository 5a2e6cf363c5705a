package com.maestro.runtime.pool;

import java.util.List;
import java.util.Objects;

/**
 * Computes the size change of an elastic pool from the pending counts of its routees.
 * A routee is pressured when its pending count exceeds {@code backlogThreshold × mailboxCapacity};
 * pressure is the pressured fraction of the pool. Grows by one above the backlog threshold,
 * shrinks by one below the backoff threshold; the size stays within {@code [1, upperBound]}.
 */
public final class PoolResizer {

    public static final int LOWER_BOUND = 1;

    private final int upperBound;
    private final PoolSettings settings;

    public PoolResizer(int upperBound, PoolSettings settings) {
        if (upperBound < LOWER_BOUND) throw new IllegalArgumentException("upperBound must be >= 1: " + upperBound);
        this.upperBound = upperBound;
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public int getUpperBound() {
        return upperBound;
    }

    public PoolSettings getSettings() {
        return settings;
    }

    /** Fraction of routees whose backlog exceeds the threshold; 0 for an empty pool. */
    public double pressure(List<Integer> pendingCounts) {
        if (pendingCounts.isEmpty()) return 0;
        double limit = settings.backlogThreshold() * settings.mailboxCapacity();
        long pressured = pendingCounts.stream().filter(p -> p > limit).count();
        return (double) pressured / pendingCounts.size();
    }

    /**
     * @return +1, -1 or 0
     */
    public int capacityDelta(List<Integer> pendingCounts) {
        int size = pendingCounts.size();
        if (size < LOWER_BOUND) {
            return LOWER_BOUND - size;
        }
        double pressure = pressure(pendingCounts);
        if (pressure > settings.backlogThreshold() && size < upperBound) {
            return 1;
        }
        if (pressure < settings.backoffThreshold() && size > LOWER_BOUND) {
            return -1;
        }
        return 0;
    }
}
