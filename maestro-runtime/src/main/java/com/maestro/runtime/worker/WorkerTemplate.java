package com.maestro.runtime.worker;

import com.maestro.plugin.Performer;
import com.maestro.plugin.PerformerContext;
import com.maestro.plugin.PerformerFactory;
import com.maestro.runtime.dispatch.Dispatcher;
import com.maestro.runtime.supervision.WorkerSupervisor;

import java.util.Objects;

/**
 * Everything needed to spawn workers for one performer: factory, wiring and lane choice. Pools spawn
 * every routee from the same template.
 */
public final class WorkerTemplate {

    private final String performerId;
    private final PerformerFactory factory;
    private final PerformerContext context;
    private final Dispatcher dispatcher;
    private final boolean controlAware;

    public WorkerTemplate(String performerId, PerformerFactory factory, PerformerContext context,
                          Dispatcher dispatcher, boolean controlAware) {
        this.performerId = Objects.requireNonNull(performerId, "performerId");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.context = Objects.requireNonNull(context, "context");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.controlAware = controlAware;
    }

    public String getPerformerId() {
        return performerId;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public boolean isControlAware() {
        return controlAware;
    }

    /**
     * Creates the first performer instance on the calling thread, then starts a watched worker.
     *
     * @throws Exception from {@link PerformerFactory#create()}; no worker is started then
     */
    public PerformerWorker spawn(String address, WorkerSupervisor watcher) throws Exception {
        Performer first = factory.create();
        if (first == null) {
            throw new IllegalStateException("Factory returned no performer for " + performerId);
        }
        PerformerWorker worker = new PerformerWorker(performerId, address, factory, context,
                new Mailbox(controlAware), dispatcher.lane(controlAware), dispatcher.scheduler(),
                dispatcher.getThroughput());
        worker.watch(watcher);
        worker.start(first);
        return worker;
    }
}
