package com.maestro.runtime.worker;

/**
 * Mailbox entries handled by the worker itself rather than the performer.
 */
enum SystemSignal {
    /** First entry of a worker: runs {@code onStart}. */
    START,
    /** Immediate stop, queued ahead of pending messages. */
    STOP,
    /** Stop after everything queued before it; queued last. */
    DRAIN_STOP,
    TICK,
    PRINT_PATH
}
