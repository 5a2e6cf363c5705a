package com.maestro.runtime.worker;

import com.maestro.plugin.Performer;
import com.maestro.plugin.PerformerContext;
import com.maestro.plugin.PerformerFactory;
import com.maestro.runtime.supervision.SupervisionDecision;
import com.maestro.runtime.supervision.TerminationCause;
import com.maestro.runtime.supervision.WorkerSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Actor-style host of one performer instance: a private {@link Mailbox} drained by turns of at most
 * {@code throughput} messages on a dispatcher lane, one message at a time.
 * <p>
 * An exception or a non-VM {@link Error} (for example a {@link LinkageError} from a performer jar) thrown by a
 * performer hook asks the watcher for a {@link SupervisionDecision}. RESTART replaces the
 * instance from the same factory with the same context; STOP makes the worker DEAD and reports the termination.
 * The performer instance and the state are touched only from drain turns, which never overlap.
 */
public final class PerformerWorker implements WorkerHandle {

    private static final Logger log = LoggerFactory.getLogger(PerformerWorker.class);

    private final String id;
    private final String address;
    private final PerformerFactory factory;
    private final PerformerContext context;
    private final Mailbox mailbox;
    private final Executor lane;
    private final ScheduledExecutorService scheduler;
    private final int throughput;
    private final AtomicBoolean drainScheduled = new AtomicBoolean();

    private volatile WorkerState state = WorkerState.RUNNING;
    private volatile WorkerSupervisor watcher;
    private volatile boolean inFlight;
    private volatile ScheduledFuture<?> tick;
    private Performer performer;

    PerformerWorker(String id, String address, PerformerFactory factory, PerformerContext context,
                    Mailbox mailbox, Executor lane, ScheduledExecutorService scheduler, int throughput) {
        this.id = Objects.requireNonNull(id, "id");
        this.address = Objects.requireNonNull(address, "address");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.context = Objects.requireNonNull(context, "context").withSelf(this);
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox");
        this.lane = Objects.requireNonNull(lane, "lane");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.throughput = throughput;
    }

    /**
     * Starts the worker with its first instance. {@code onStart} runs on the worker as its first entry;
     * ticks begin when the schedule is positive.
     */
    void start(Performer first) {
        this.performer = Objects.requireNonNull(first, "first");
        mailbox.offerSystem(SystemSignal.START);
        Duration schedule = context.getSchedule();
        if (!schedule.isZero() && !schedule.isNegative()) {
            long millis = schedule.toMillis();
            tick = scheduler.scheduleAtFixedRate(this::enqueueTick, millis, millis, TimeUnit.MILLISECONDS);
        }
        scheduleDrain();
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

    public PerformerContext getContext() {
        return context;
    }

    @Override
    public boolean tell(Object message) {
        if (deliver(message)) {
            return true;
        }
        log.warn("Dead letter to performer={} address={} state={}: {}", id, address, state, message);
        return false;
    }

    /**
     * Enqueues without logging a dead letter.
     *
     * @return false when the worker is terminal or its mailbox is closed
     */
    public boolean deliver(Object message) {
        if (state.isTerminal() || !mailbox.offer(message)) {
            return false;
        }
        scheduleDrain();
        return true;
    }

    @Override
    public void stop() {
        if (state.isTerminal()) {
            return;
        }
        mailbox.offerSystem(SystemSignal.STOP);
        scheduleDrain();
    }

    /**
     * Stops after every message already queued has been processed; the mailbox closes to new deliveries.
     */
    public void drainAndStop() {
        if (state.isTerminal()) {
            return;
        }
        if (mailbox.offerLastAndClose(SystemSignal.DRAIN_STOP)) {
            scheduleDrain();
        }
    }

    @Override
    public int pendingCount() {
        return mailbox.size() + (inFlight ? 1 : 0);
    }

    @Override
    public void printPath() {
        if (!state.isTerminal()) {
            mailbox.offerSystem(SystemSignal.PRINT_PATH);
            scheduleDrain();
        }
    }

    @Override
    public void watch(WorkerSupervisor supervisor) {
        this.watcher = supervisor;
    }

    @Override
    public void unwatch() {
        this.watcher = null;
    }

    private void enqueueTick() {
        if (!state.isTerminal() && mailbox.offer(SystemSignal.TICK)) {
            scheduleDrain();
        }
    }

    private void scheduleDrain() {
        if (drainScheduled.compareAndSet(false, true)) {
            try {
                lane.execute(this::drain);
            } catch (RejectedExecutionException e) {
                drainScheduled.set(false);
                log.warn("Dispatcher rejected drain of performer={} address={}; dispatcher is shut down", id, address);
            }
        }
    }

    private void drain() {
        try {
            int processed = 0;
            while (processed < throughput && !state.isTerminal()) {
                Object next = mailbox.poll();
                if (next == null) break;
                inFlight = true;
                try {
                    process(next);
                } finally {
                    inFlight = false;
                }
                processed++;
            }
        } finally {
            drainScheduled.set(false);
            if (!state.isTerminal() && !mailbox.isEmpty()) {
                scheduleDrain();
            }
        }
    }

    private void process(Object entry) {
        if (entry instanceof SystemSignal signal) {
            switch (signal) {
                case START -> invoke(entry, () -> performer.onStart(context));
                case TICK -> invoke(entry, () -> performer.onTick());
                case PRINT_PATH -> log.info("Performer path: {}", address);
                case STOP, DRAIN_STOP -> terminate(WorkerState.STOPPED, TerminationCause.stopped());
                default -> log.warn("Unhandled signal {} for performer={}", signal, id);
            }
            return;
        }
        invoke(entry, () -> performer.onMessage(entry));
    }

    private void invoke(Object entry, Hook hook) {
        try {
            hook.run();
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            handleFailure(e, entry);
        }
    }

    private void handleFailure(Throwable cause, Object entry) {
        log.error("Performer failed performer={} address={} entry={}: {}", id, address, entry, cause.getMessage(), cause);
        WorkerSupervisor w = watcher;
        SupervisionDecision decision = w != null ? w.onFailure(this, cause) : SupervisionDecision.STOP;
        if (entry != null && !(entry instanceof SystemSignal)) {
            log.warn("Dropped message performer={} after failure: {}", id, entry);
        }
        if (decision == SupervisionDecision.RESTART) {
            restart(cause);
        } else {
            terminate(WorkerState.DEAD, TerminationCause.failed(cause));
        }
    }

    private void restart(Throwable cause) {
        state = WorkerState.RESTARTING;
        log.info("Restarting performer={} address={} after: {}", id, address, cause.toString());
        stopInstance();
        try {
            performer = factory.create();
            performer.onStart(context);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            handleFailure(e, null);
            return;
        }
        state = WorkerState.RUNNING;
    }

    private void terminate(WorkerState terminal, TerminationCause cause) {
        if (state.isTerminal()) {
            return;
        }
        state = terminal;
        ScheduledFuture<?> t = tick;
        if (t != null) t.cancel(false);
        mailbox.close();
        List<Object> dropped = mailbox.drainMessages();
        if (!dropped.isEmpty()) {
            log.warn("Dropped {} pending message(s) of performer={} on {}", dropped.size(), id, terminal);
        }
        stopInstance();
        if (terminal == WorkerState.DEAD) {
            log.error("DEAD performer={} address={}", id, address);
        } else {
            log.debug("Stopped performer={} address={}", id, address);
        }
        WorkerSupervisor w = watcher;
        if (w != null) {
            w.onTerminated(this, cause);
        }
    }

    private void stopInstance() {
        Performer p = performer;
        if (p == null) return;
        try {
            p.onStop();
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            log.warn("onStop failed for performer={} address={}: {}", id, address, e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "PerformerWorker{" + address + ", state=" + state + "}";
    }

    @FunctionalInterface
    private interface Hook {
        void run() throws Exception;
    }
}
