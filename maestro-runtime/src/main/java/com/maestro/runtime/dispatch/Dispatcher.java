package com.maestro.runtime.dispatch;

import com.maestro.config.MaestroConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread resources shared by all workers: a default lane for ordinary workers, a control lane of
 * maximum-priority threads for control-aware workers, and a single scheduler thread for ticks and
 * pool resizes. Workers never own threads; they submit drain turns of at most {@link #getThroughput()}
 * messages to their lane.
 */
public final class Dispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);
    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final ExecutorService defaultLane;
    private final ExecutorService controlLane;
    private final ScheduledExecutorService scheduler;
    private final int throughput;

    public Dispatcher(int workerThreads, int controlThreads, int throughput) {
        if (workerThreads < 1 || controlThreads < 1 || throughput < 1) {
            throw new IllegalArgumentException("Dispatcher sizes must be >= 1: workerThreads=" + workerThreads
                    + ", controlThreads=" + controlThreads + ", throughput=" + throughput);
        }
        this.defaultLane = Executors.newFixedThreadPool(workerThreads, namedThreads("maestro-worker", Thread.NORM_PRIORITY));
        this.controlLane = Executors.newFixedThreadPool(controlThreads, namedThreads("maestro-control", Thread.MAX_PRIORITY));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("maestro-scheduler", Thread.NORM_PRIORITY));
        this.throughput = throughput;
        log.info("Dispatcher started: workerThreads={}, controlThreads={}, throughput={}",
                workerThreads, controlThreads, throughput);
    }

    public static Dispatcher fromConfig(MaestroConfig config) {
        return new Dispatcher(config.getWorkerThreads(), config.getControlThreads(), config.getDispatchThroughput());
    }

    /** Lane a worker's drain turns run on. */
    public Executor lane(boolean control) {
        return control ? controlLane : defaultLane;
    }

    public ScheduledExecutorService scheduler() {
        return scheduler;
    }

    /** Maximum messages a worker processes per drain turn. */
    public int getThroughput() {
        return throughput;
    }

    public boolean isShutdown() {
        return defaultLane.isShutdown();
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
        defaultLane.shutdown();
        controlLane.shutdown();
        try {
            if (!defaultLane.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) defaultLane.shutdownNow();
            if (!controlLane.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) controlLane.shutdownNow();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            defaultLane.shutdownNow();
            controlLane.shutdownNow();
        }
        log.info("Dispatcher closed");
    }

    private static ThreadFactory namedThreads(String prefix, int priority) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            t.setPriority(priority);
            return t;
        };
    }
}
