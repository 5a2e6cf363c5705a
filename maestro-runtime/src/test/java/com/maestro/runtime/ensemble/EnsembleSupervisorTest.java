package com.maestro.runtime.ensemble;

import com.maestro.ensemblespec.graph.GraphModelBuilder;
import com.maestro.runtime.dispatch.Dispatcher;
import com.maestro.runtime.pool.ElasticPool;
import com.maestro.runtime.support.Await;
import com.maestro.runtime.support.MapPluginLoader;
import com.maestro.runtime.support.PerformerRecorder;
import com.maestro.runtime.support.Specs;
import com.maestro.runtime.worker.WorkerHandle;
import com.maestro.runtime.worker.WorkerState;
import com.maestro.telemetry.TelemetryNotifier;
import com.maestro.telemetry.TelemetrySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnsembleSupervisorTest {

    private Dispatcher dispatcher;
    private MapPluginLoader loader;
    private RecordingSink sink;
    private EnsembleRuntime runtime;
    private final List<EnsembleRestartRequired> signals = new CopyOnWriteArrayList<>();
    private final Map<String, PerformerRecorder> recorders = new HashMap<>();
    private EnsembleSupervisor supervisor;

    @BeforeEach
    void setUp() {
        dispatcher = new Dispatcher(4, 1, 10);
        loader = new MapPluginLoader();
        for (String id : List.of("A", "B", "C")) {
            PerformerRecorder recorder = new PerformerRecorder();
            recorders.put(id, recorder);
            loader.register(Specs.classOf(id), recorder.factory());
        }
        sink = new RecordingSink();
        runtime = EnsembleRuntime.builder()
                .dispatcher(dispatcher)
                .pluginLoader(loader)
                .telemetry(new TelemetryNotifier(sink))
                .graphModelBuilder(new GraphModelBuilder(Path.of("/static"), Path.of("/dynamic")))
                .orchestrationId("orch")
                .build();
        supervisor = new EnsembleSupervisor("ens", runtime, signals::add);
    }

    @AfterEach
    void tearDown() {
        supervisor.stop();
        dispatcher.close();
    }

    private static Specs abc() {
        return Specs.ensemble("ens")
                .performer("A").performer("B").performer("C")
                .connect("B", "C");
    }

    @Test
    void startBuildsEveryPerformerAndRuns() {
        BuildOutcome outcome = supervisor.start(abc().build());

        assertTrue(outcome.isSuccess());
        EnsembleSnapshot snapshot = outcome.getSnapshot().orElseThrow();
        assertEquals(1, snapshot.generation());
        assertEquals(EnsemblePhase.RUNNING, snapshot.phase());
        assertEquals(Set.of("A", "B", "C"), supervisor.getWorkerNames());
        assertEquals(3, snapshot.workerAddresses().size());
        assertEquals(EnsemblePhase.RUNNING, supervisor.getPhase());
        assertEquals(List.of("start:ens"), sink.events);
        Await.until(() -> recorders.values().stream().allMatch(p -> p.starts.get() == 1), "all started");
    }

    @Test
    void startTwiceIsRejected() {
        supervisor.start(abc().build());

        assertThrows(IllegalStateException.class, () -> supervisor.start(abc().build()));
    }

    @Test
    void unknownPerformerRollsBackAndSignals() {
        BuildOutcome outcome = supervisor.start(Specs.ensemble("ens")
                .performer("A").performer("C")
                .connect("C")
                .connect("A", "B")
                .build());

        assertFalse(outcome.isSuccess());
        EnsembleRestartRequired signal = outcome.getSignal().orElseThrow();
        assertTrue(signal.reason().startsWith("Not able to create the Performers"), signal.reason());
        assertInstanceOf(UnknownPerformerException.class, signal.failure().orElseThrow());
        assertTrue(signal.deadWorker().isEmpty());
        assertEquals(List.of(signal), signals);
        assertEquals(EnsemblePhase.TORN_DOWN, supervisor.getPhase());
        assertTrue(supervisor.getWorkerNames().isEmpty());
        Await.until(() -> recorders.get("C").stops.get() == 1, "C rolled back");
        assertEquals(0, recorders.get("A").created.get());
    }

    @Test
    void linkageErrorDuringCreationRollsBackAndSignals() {
        loader.register(Specs.classOf("B"), () -> {
            throw new NoClassDefFoundError("com/acme/MissingDependency");
        });

        BuildOutcome outcome = supervisor.start(abc().build());

        assertFalse(outcome.isSuccess());
        EnsembleRestartRequired signal = outcome.getSignal().orElseThrow();
        PerformerCreationException failure =
                assertInstanceOf(PerformerCreationException.class, signal.failure().orElseThrow());
        assertEquals("B", failure.getPerformerId());
        assertInstanceOf(NoClassDefFoundError.class, failure.getCause());
        assertEquals(List.of(signal), signals);
        assertEquals(EnsemblePhase.TORN_DOWN, supervisor.getPhase());
        Await.until(() -> recorders.get("C").stops.get() == 1, "C rolled back");

        BuildOutcome again = supervisor.restart("retry");

        assertFalse(again.isSuccess());
        assertEquals(2, supervisor.getGeneration());
        assertEquals(EnsemblePhase.TORN_DOWN, supervisor.getPhase());
        Await.until(() -> recorders.get("C").stops.get() == 2, "C rolled back again");
    }

    @Test
    void unexpectedErrorFromPluginLoaderStillRollsBack() {
        EnsembleRuntime failingRuntime = EnsembleRuntime.builder()
                .dispatcher(dispatcher)
                .pluginLoader((classPath, location, jar) -> {
                    if (classPath.equals(Specs.classOf("B"))) {
                        throw new ExceptionInInitializerError("static init of " + classPath);
                    }
                    return loader.load(classPath, location, jar);
                })
                .graphModelBuilder(new GraphModelBuilder(Path.of("/static"), Path.of("/dynamic")))
                .orchestrationId("orch")
                .build();
        EnsembleSupervisor other = new EnsembleSupervisor("ens", failingRuntime, signals::add);

        BuildOutcome outcome = other.start(abc().build());

        assertFalse(outcome.isSuccess());
        assertInstanceOf(ExceptionInInitializerError.class, outcome.getSignal().orElseThrow().failure().orElseThrow());
        assertEquals(EnsemblePhase.TORN_DOWN, other.getPhase());
        assertEquals(1, signals.size());
        Await.until(() -> recorders.get("C").stops.get() == 1, "C rolled back");
    }

    @Test
    void connectionCycleRollsBackWithoutCreatingWorkers() {
        BuildOutcome outcome = supervisor.start(Specs.ensemble("ens")
                .performer("A").performer("B")
                .connect("A", "B")
                .connect("B", "A")
                .build());

        assertFalse(outcome.isSuccess());
        ConnectionCycleException failure =
                assertInstanceOf(ConnectionCycleException.class, outcome.getSignal().orElseThrow().failure().orElseThrow());
        assertEquals(List.of("A", "B", "A"), failure.getCycle());
        assertEquals(EnsemblePhase.TORN_DOWN, supervisor.getPhase());
        assertEquals(0, recorders.get("A").created.get());
        assertEquals(0, recorders.get("B").created.get());
    }

    @Test
    void pooledRouteeDeathEscalatesAsDeathOfThePerformer() {
        supervisor.start(Specs.ensemble("ens")
                .pooled("A", 2).performer("B")
                .connect("B", "A")
                .build());
        WorkerHandle pool = supervisor.getHandle("A").orElseThrow();
        assertInstanceOf(ElasticPool.class, pool);
        Await.until(() -> recorders.get("A").starts.get() == 1 && recorders.get("B").starts.get() == 1, "started");

        for (int i = 0; i < 4; i++) {
            pool.tell(PerformerRecorder.FAIL);
        }

        Await.until(() -> signals.size() == 1, "restart signal");
        EnsembleRestartRequired signal = signals.get(0);
        assertEquals("DEAD Performer A", signal.reason());
        assertEquals("maestro://orch/ens/A", signal.deadWorker().orElseThrow());
        assertEquals(WorkerState.DEAD, pool.getState());
        assertEquals(EnsemblePhase.TORN_DOWN, supervisor.getPhase());
        Await.until(() -> recorders.get("B").stops.get() == 1, "B stopped");
    }

    @Test
    void repeatedFailuresEscalateAndStopTheOthers() {
        supervisor.start(abc().build());
        WorkerHandle a = supervisor.getHandle("A").orElseThrow();
        Await.until(() -> recorders.values().stream().allMatch(p -> p.starts.get() == 1), "all started");

        for (int i = 0; i < 4; i++) {
            a.tell(PerformerRecorder.FAIL);
        }

        Await.until(() -> signals.size() == 1, "restart signal");
        EnsembleRestartRequired signal = signals.get(0);
        assertEquals("DEAD Performer A", signal.reason());
        assertEquals("maestro://orch/ens/A", signal.deadWorker().orElseThrow());
        assertEquals(1, signal.generation());
        assertEquals(EnsemblePhase.TORN_DOWN, supervisor.getPhase());
        assertEquals(WorkerState.DEAD, a.getState());
        assertEquals(4, recorders.get("A").created.get());
        Await.until(() -> recorders.get("B").stops.get() == 1 && recorders.get("C").stops.get() == 1, "others stopped");
        assertTrue(sink.events.contains("terminate:ens:maestro://orch/ens/A"));
    }

    @Test
    void fewerFailuresThanTheLimitAreAbsorbed() {
        supervisor.start(abc().build());
        WorkerHandle a = supervisor.getHandle("A").orElseThrow();

        for (int i = 0; i < 3; i++) {
            a.tell(PerformerRecorder.FAIL);
        }
        a.tell("after");

        Await.until(() -> recorders.get("A").received.contains("after"), "message after restarts");
        assertEquals(4, recorders.get("A").created.get());
        assertEquals(EnsemblePhase.RUNNING, supervisor.getPhase());
        assertTrue(signals.isEmpty());
    }

    @Test
    void stopSendsOneStopPerWorkerAndIsIdempotent() {
        supervisor.start(abc().build());
        Await.until(() -> recorders.values().stream().allMatch(p -> p.starts.get() == 1), "all started");

        supervisor.stop();
        supervisor.stop();

        Await.until(() -> recorders.values().stream().allMatch(p -> p.stops.get() == 1), "all stopped");
        assertEquals(EnsemblePhase.STOPPED, supervisor.getPhase());
        assertTrue(supervisor.getWorkerNames().isEmpty());
        assertEquals(List.of("start:ens", "stop:ens"), sink.events);
        assertTrue(signals.isEmpty());
        assertThrows(IllegalStateException.class, () -> supervisor.start(abc().build()));
    }

    @Test
    void restartBuildsNextGenerationWithFreshWorkers() {
        supervisor.start(abc().build());
        WorkerHandle first = supervisor.getHandle("A").orElseThrow();

        BuildOutcome outcome = supervisor.restart("manual");

        assertTrue(outcome.isSuccess());
        assertEquals(2, supervisor.getGeneration());
        WorkerHandle second = supervisor.getHandle("A").orElseThrow();
        assertNotSame(first, second);
        Await.until(() -> first.getState() == WorkerState.STOPPED, "old worker stopped");
        assertEquals(List.of("start:ens", "restart:ens:manual", "start:ens"), sink.events);
        assertEquals(EnsemblePhase.RUNNING, supervisor.getPhase());
    }

    @Test
    void restartBeforeStartIsRejected() {
        assertThrows(IllegalStateException.class, () -> supervisor.restart("early"));
    }

    @Test
    void describeAndRenderShowEdgesNodesAndPerformers() {
        supervisor.start(abc().build());

        EnsembleSnapshot snapshot = supervisor.describe();

        assertEquals(Map.of("B", List.of("C")), snapshot.edges());
        assertEquals(Set.of("A", "B", "C"), Set.copyOf(snapshot.performerIds()));
        String text = supervisor.toString();
        assertTrue(text.startsWith("Edges: \n \t B : [C]"), text);
        assertTrue(text.contains("Nodes: \n\t["), text);
        assertTrue(text.contains("Performers \n\t["), text);
        supervisor.printEnsemble();
    }

    @Test
    void mismatchedGuidUsesSupervisorId() {
        BuildOutcome outcome = supervisor.start(Specs.ensemble("other").performer("A").build());

        assertEquals("ens", outcome.getSnapshot().orElseThrow().ensembleId());
        assertEquals("maestro://orch/ens/A", supervisor.getHandle("A").orElseThrow().getAddress());
    }

    static final class RecordingSink implements TelemetrySink {
        final List<String> events = new CopyOnWriteArrayList<>();

        @Override
        public void start(String ensembleId, long timestampMillis) {
            events.add("start:" + ensembleId);
        }

        @Override
        public void stop(String ensembleId, long timestampMillis) {
            events.add("stop:" + ensembleId);
        }

        @Override
        public void restart(String ensembleId, String reason, long timestampMillis) {
            events.add("restart:" + ensembleId + ":" + reason);
        }

        @Override
        public void terminate(String ensembleId, String workerAddress, long timestampMillis) {
            events.add("terminate:" + ensembleId + ":" + workerAddress);
        }
    }
}
