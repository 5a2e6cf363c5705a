package com.maestro.runtime.pool;

import com.maestro.config.MaestroConfig;

/**
 * Resize parameters shared by every elastic pool of a runtime.
 *
 * @param messagesPerResize dispatched messages between resize checks
 * @param mailboxCapacity   nominal routee capacity the backlog is measured against
 * @param backlogThreshold  fraction of capacity above which a routee counts as pressured; also the grow threshold
 * @param backoffThreshold  pressure below which the pool shrinks
 */
public record PoolSettings(int messagesPerResize, int mailboxCapacity, double backlogThreshold, double backoffThreshold) {

    public PoolSettings {
        if (messagesPerResize < 1) throw new IllegalArgumentException("messagesPerResize must be >= 1: " + messagesPerResize);
        if (mailboxCapacity < 1) throw new IllegalArgumentException("mailboxCapacity must be >= 1: " + mailboxCapacity);
        if (backlogThreshold <= 0 || backlogThreshold > 1) {
            throw new IllegalArgumentException("backlogThreshold must be in (0, 1]: " + backlogThreshold);
        }
        if (backoffThreshold < 0 || backoffThreshold >= backlogThreshold) {
            throw new IllegalArgumentException("backoffThreshold must be in [0, backlogThreshold): " + backoffThreshold);
        }
    }

    public static PoolSettings defaults() {
        return new PoolSettings(500, 50, 0.4, 0.1);
    }

    public static PoolSettings fromConfig(MaestroConfig config) {
        return new PoolSettings(config.getMessagesPerResize(), config.getMailboxCapacity(),
                config.getBacklogThreshold(), config.getBackoffThreshold());
    }
}
