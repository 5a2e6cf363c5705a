package com.maestro.runtime.pool;

import com.maestro.runtime.supervision.FailureWindow;
import com.maestro.runtime.supervision.RestartPolicy;
import com.maestro.runtime.supervision.SupervisionDecision;
import com.maestro.runtime.supervision.TerminationCause;
import com.maestro.runtime.supervision.WorkerSupervisor;
import com.maestro.runtime.worker.PerformerWorker;
import com.maestro.runtime.worker.WorkerHandle;
import com.maestro.runtime.worker.WorkerState;
import com.maestro.runtime.worker.WorkerTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Elastic pool of identical workers behind one handle. Dispatch goes to the routee with the smallest
 * pending count (lowest index on ties). Every {@code messagesPerResize} dispatches a resize runs on the
 * scheduler thread, at most one at a time.
 * <p>
 * Shrinking removes the last routee from the routing table first, then queues a drain-then-stop behind its
 * pending messages; a dispatch that races with the removal finds the mailbox closed and is retried against
 * the fresh table. A draining routee stays supervised by the pool until its drain completes, so a failure
 * while draining restarts it in place and the queued messages are still processed.
 * Routees are supervised by the pool with the bounded restart policy; a routing routee reaching DEAD kills
 * the whole pool and the termination is reported to the pool's watcher.
 */
public final class ElasticPool implements WorkerHandle, WorkerSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ElasticPool.class);

    private final String id;
    private final String address;
    private final WorkerTemplate template;
    private final PoolResizer resizer;
    private final RestartPolicy restartPolicy;
    private final ScheduledExecutorService scheduler;
    private final List<PerformerWorker> routees = new CopyOnWriteArrayList<>();
    private final List<PerformerWorker> draining = new CopyOnWriteArrayList<>();
    private final Map<String, FailureWindow> failures = new ConcurrentHashMap<>();
    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicBoolean resizing = new AtomicBoolean();
    private final AtomicInteger routeeCounter = new AtomicInteger();

    private volatile WorkerState state = WorkerState.RUNNING;
    private volatile WorkerSupervisor watcher;

    public ElasticPool(String address, WorkerTemplate template, PoolResizer resizer, RestartPolicy restartPolicy) {
        this.address = Objects.requireNonNull(address, "address");
        this.template = Objects.requireNonNull(template, "template");
        this.id = template.getPerformerId();
        this.resizer = Objects.requireNonNull(resizer, "resizer");
        this.restartPolicy = Objects.requireNonNull(restartPolicy, "restartPolicy");
        this.scheduler = template.getDispatcher().scheduler();
    }

    /**
     * Spawns the first routee on the calling thread.
     *
     * @throws Exception when the first performer instance cannot be created
     */
    public void start() throws Exception {
        synchronized (this) {
            routees.add(spawnRoutee());
        }
        log.info("Started pool performer={} address={} bounds=[{}, {}]",
                id, address, PoolResizer.LOWER_BOUND, resizer.getUpperBound());
    }

    private PerformerWorker spawnRoutee() throws Exception {
        String routeeAddress = address + "/$" + routeeCounter.incrementAndGet();
        return template.spawn(routeeAddress, this);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getAddress() {
        return address;
    }

    @Override
    public WorkerState getState() {
        return state;
    }

    public int size() {
        return routees.size();
    }

    /** Snapshot of the routing table. */
    public List<PerformerWorker> getRoutees() {
        return List.copyOf(routees);
    }

    @Override
    public boolean tell(Object message) {
        int attempts = 2 * resizer.getUpperBound() + 2;
        for (int i = 0; i < attempts && !state.isTerminal(); i++) {
            PerformerWorker target = smallestMailbox(routees);
            if (target == null) {
                break;
            }
            if (target.deliver(message)) {
                if (dispatched.incrementAndGet() % resizer.getSettings().messagesPerResize() == 0) {
                    requestResize();
                }
                return true;
            }
            log.debug("Routee {} rejected delivery; retrying against current routing table", target.getAddress());
        }
        log.warn("Dead letter to pool performer={} address={} state={}: {}", id, address, state, message);
        return false;
    }

    static PerformerWorker smallestMailbox(List<PerformerWorker> table) {
        PerformerWorker best = null;
        int bestPending = Integer.MAX_VALUE;
        for (PerformerWorker routee : table) {
            int pending = routee.pendingCount();
            if (pending < bestPending) {
                best = routee;
                bestPending = pending;
            }
        }
        return best;
    }

    private void requestResize() {
        if (!resizing.compareAndSet(false, true)) {
            return;
        }
        try {
            scheduler.execute(() -> {
                try {
                    resize();
                } finally {
                    resizing.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            resizing.set(false);
            log.debug("Resize of pool {} rejected; scheduler is shut down", address);
        }
    }

    /**
     * Applies one resize step. Runs on the scheduler thread.
     */
    void resize() {
        PerformerWorker removed = null;
        synchronized (this) {
            if (state.isTerminal()) return;
            List<Integer> pending = new ArrayList<>(routees.size());
            for (PerformerWorker r : routees) pending.add(r.pendingCount());
            int delta = resizer.capacityDelta(pending);
            if (delta > 0) {
                try {
                    routees.add(spawnRoutee());
                    log.info("Pool performer={} grew to {} routee(s)", id, routees.size());
                } catch (Exception | LinkageError e) {
                    log.error("Pool performer={} could not add a routee: {}", id, e.getMessage(), e);
                }
            } else if (delta < 0 && routees.size() > PoolResizer.LOWER_BOUND) {
                removed = routees.remove(routees.size() - 1);
                draining.add(removed);
                log.info("Pool performer={} shrank to {} routee(s)", id, routees.size());
            }
        }
        if (removed != null) {
            removed.drainAndStop();
        }
    }

    @Override
    public SupervisionDecision onFailure(WorkerHandle worker, Throwable cause) {
        FailureWindow window = failures.computeIfAbsent(worker.getAddress(), a -> restartPolicy.newWindow());
        return restartPolicy.decide(window);
    }

    @Override
    public void onTerminated(WorkerHandle worker, TerminationCause cause) {
        List<PerformerWorker> others;
        synchronized (this) {
            if (draining.remove(worker)) {
                failures.remove(worker.getAddress());
                if (cause.isFailure()) {
                    log.error("Draining routee {} of pool performer={} died before finishing its queue",
                            worker.getAddress(), id);
                } else {
                    log.debug("Routee {} of pool performer={} drained and stopped", worker.getAddress(), id);
                }
                return;
            }
            if (state.isTerminal() || !routees.contains(worker)) {
                return;
            }
            state = WorkerState.DEAD;
            others = new ArrayList<>(routees);
            others.addAll(draining);
            routees.clear();
            draining.clear();
        }
        log.error("Routee {} of pool performer={} terminated ({}); stopping the pool",
                worker.getAddress(), id, cause.kind());
        for (PerformerWorker r : others) {
            if (r != worker) {
                r.unwatch();
                r.stop();
            }
        }
        WorkerSupervisor w = watcher;
        if (w != null) {
            w.onTerminated(this, cause.isFailure() ? cause : TerminationCause.failed(
                    new IllegalStateException("Routee " + worker.getAddress() + " stopped")));
        }
    }

    @Override
    public void stop() {
        List<PerformerWorker> all;
        synchronized (this) {
            if (state.isTerminal()) return;
            state = WorkerState.STOPPED;
            all = new ArrayList<>(routees);
            all.addAll(draining);
            routees.clear();
            draining.clear();
        }
        for (PerformerWorker r : all) {
            r.unwatch();
            r.stop();
        }
        log.debug("Stopped pool performer={} address={}", id, address);
        WorkerSupervisor w = watcher;
        if (w != null) {
            w.onTerminated(this, TerminationCause.stopped());
        }
    }

    @Override
    public int pendingCount() {
        int n = 0;
        for (PerformerWorker r : routees) n += r.pendingCount();
        return n;
    }

    @Override
    public void printPath() {
        log.info("Performer path: {}", address);
        for (PerformerWorker r : routees) r.printPath();
    }

    @Override
    public void watch(WorkerSupervisor supervisor) {
        this.watcher = supervisor;
    }

    @Override
    public void unwatch() {
        this.watcher = null;
    }

    @Override
    public String toString() {
        return "ElasticPool{" + address + ", size=" + routees.size() + ", state=" + state + "}";
    }
}
