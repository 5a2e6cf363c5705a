package com.maestro.bootstrap.performers;

import com.maestro.plugin.Performer;
import com.maestro.plugin.PerformerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Built-in performer: logs every message and forwards it to all of its connections. A positive
 * schedule makes it emit its {@code message} parameter (default {@code tick}) on every tick.
 */
public final class EchoPerformer implements Performer {

    private static final Logger log = LoggerFactory.getLogger(EchoPerformer.class);

    private PerformerContext context;

    @Override
    public void onStart(PerformerContext context) {
        this.context = context;
        log.debug("Echo performer={} started in ensemble={}", context.getPerformerId(), context.getEnsembleId());
    }

    @Override
    public void onMessage(Object message) {
        int forwarded = context.propagate(message);
        log.info("performer={} ensemble={} message={} forwarded={}",
                context.getPerformerId(), context.getEnsembleId(), message, forwarded);
    }

    @Override
    public void onTick() {
        String message = context.getParameter("message");
        context.propagate(message != null ? message : "tick");
    }
}
