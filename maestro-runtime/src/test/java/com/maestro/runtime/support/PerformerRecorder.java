package com.maestro.runtime.support;

import com.maestro.plugin.Performer;
import com.maestro.plugin.PerformerContext;
import com.maestro.plugin.PerformerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared recorder for {@link ScriptedPerformer} instances created by one factory.
 * The message {@code "boom"} makes the receiving instance throw; {@code "block"} waits on {@link #gate}.
 */
public final class PerformerRecorder {

    public static final String FAIL = "boom";
    public static final String BLOCK = "block";

    public final AtomicInteger created = new AtomicInteger();
    public final AtomicInteger starts = new AtomicInteger();
    public final AtomicInteger stops = new AtomicInteger();
    public final AtomicInteger ticks = new AtomicInteger();
    public final List<Object> received = new CopyOnWriteArrayList<>();
    public final List<PerformerContext> contexts = new CopyOnWriteArrayList<>();
    public final List<String> threads = new CopyOnWriteArrayList<>();
    public final CountDownLatch gate = new CountDownLatch(1);
    public final CountDownLatch blocked = new CountDownLatch(1);
    public volatile boolean failOnStart;

    public PerformerFactory factory() {
        return () -> {
            created.incrementAndGet();
            return new ScriptedPerformer(this);
        };
    }

    public void release() {
        gate.countDown();
    }

    /** Messages received, excluding failure triggers. */
    public long delivered() {
        return received.stream().filter(m -> !FAIL.equals(m)).count();
    }

    public static final class ScriptedPerformer implements Performer {

        private final PerformerRecorder recorder;

        ScriptedPerformer(PerformerRecorder recorder) {
            this.recorder = recorder;
        }

        @Override
        public void onStart(PerformerContext context) {
            recorder.contexts.add(context);
            recorder.starts.incrementAndGet();
            if (recorder.failOnStart) {
                throw new IllegalStateException("start failure");
            }
        }

        @Override
        public void onMessage(Object message) throws Exception {
            recorder.threads.add(Thread.currentThread().getName());
            recorder.received.add(message);
            if (FAIL.equals(message)) {
                throw new IllegalStateException("scripted failure");
            }
            if (BLOCK.equals(message)) {
                recorder.blocked.countDown();
                if (!recorder.gate.await(10, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("gate never opened");
                }
            }
        }

        @Override
        public void onTick() {
            recorder.ticks.incrementAndGet();
        }

        @Override
        public void onStop() {
            recorder.stops.incrementAndGet();
        }
    }
}
