package com.maestro.runtime.supervision;

/**
 * Ring buffer of the last {@code maxFailures} failure timestamps of one worker. A failure is allowed
 * while fewer than {@code maxFailures} earlier failures fall inside the window. Thread-safe.
 */
public final class FailureWindow {

    private final long[] timestamps;
    private final long windowMillis;
    private int next;
    private int size;

    public FailureWindow(int maxFailures, long windowMillis) {
        if (maxFailures < 0) throw new IllegalArgumentException("maxFailures must be >= 0: " + maxFailures);
        if (windowMillis <= 0) throw new IllegalArgumentException("windowMillis must be > 0: " + windowMillis);
        this.timestamps = new long[maxFailures];
        this.windowMillis = windowMillis;
    }

    /**
     * Records a failure at {@code nowMillis}.
     *
     * @return true if a restart is still allowed
     */
    public synchronized boolean recordFailure(long nowMillis) {
        int max = timestamps.length;
        if (max == 0) {
            return false;
        }
        if (size == max) {
            // oldest retained failure is the max-th most recent one
            long oldest = timestamps[next];
            if (nowMillis - oldest < windowMillis) {
                return false;
            }
        }
        timestamps[next] = nowMillis;
        next = (next + 1) % max;
        if (size < max) size++;
        return true;
    }
}
