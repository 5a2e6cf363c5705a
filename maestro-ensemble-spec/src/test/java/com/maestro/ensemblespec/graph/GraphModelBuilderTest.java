package com.maestro.ensemblespec.graph;

import com.maestro.ensemblespec.EnsembleSpecJson;
import com.maestro.ensemblespec.model.EnsembleDefinition;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GraphModelBuilderTest {

    private static final Path STATIC_REPO = Path.of("/repo/static");
    private static final Path DYNAMIC_REPO = Path.of("/repo/dynamic");

    private final GraphModelBuilder builder = new GraphModelBuilder(STATIC_REPO, DYNAMIC_REPO);

    private static String performer(String guid, String extra) {
        return "{\"guid\":\"" + guid + "\",\"schedule\":0,\"backoff\":0" + extra
                + ",\"source\":{\"name\":\"" + guid.toLowerCase() + ".jar\",\"classPath\":\"com.acme." + guid + "\",\"parameters\":{}}}";
    }

    @Test
    void build_extractsPerformersWithDefaultsAndRepositorySelection() {
        EnsembleDefinition def = EnsembleSpecJson.fromJson("{\"guid\":\"e\",\"connections\":[{\"A\":[\"B\"]}],\"performers\":["
                + performer("A", "") + ","
                + "{\"guid\":\"B\",\"schedule\":100,\"backoff\":5,\"autoScale\":3,"
                + "\"source\":{\"name\":\"b.jar\",\"classPath\":\"com.acme.B\",\"parameters\":{\"k\":\"v\"}}},"
                + "{\"guid\":\"C\",\"schedule\":0,\"backoff\":0,\"controlAware\":true,"
                + "\"source\":{\"name\":\"c.jar\",\"classPath\":\"com.acme.C\",\"location\":{\"url\":\"https://repo/c.jar\"}}}]}");

        GraphModel model = builder.build(def);

        assertEquals(List.of("A", "B", "C"), List.copyOf(model.getPerformerIds()));
        PerformerSpec a = model.getPerformer("A");
        assertEquals(0, a.autoScale());
        assertFalse(a.controlAware());
        assertFalse(a.isPooled());
        assertEquals(STATIC_REPO, a.jarLocation());
        assertEquals(STATIC_REPO.resolve("a.jar"), a.jarPath());

        PerformerSpec b = model.getPerformer("B");
        assertEquals(Duration.ofMillis(100), b.schedule());
        assertEquals(Duration.ofMillis(5), b.backoff());
        assertEquals(3, b.autoScale());
        assertTrue(b.isPooled());
        assertEquals(Map.of("k", "v"), b.parameters());

        PerformerSpec c = model.getPerformer("C");
        assertTrue(c.controlAware());
        assertEquals(DYNAMIC_REPO, c.jarLocation());
    }

    @Test
    void build_connectionsMergeLastWins() {
        String json = "{\"guid\":\"e\",\"connections\":[{\"A\":[\"B\"]},{\"C\":[]},{\"A\":[\"C\"]}],\"performers\":["
                + performer("A", "") + "," + performer("B", "") + "," + performer("C", "") + "]}";

        GraphModel model = builder.build(EnsembleSpecJson.fromJson(json));

        assertEquals(List.of("A", "C"), List.copyOf(model.getConnections().keySet()));
        assertEquals(List.of("C"), model.getDependencies("A"));
        assertEquals(List.of(), model.getDependencies("B"));
    }

    @Test
    void build_doesNotValidateCrossReferences() {
        String json = "{\"guid\":\"e\",\"connections\":[{\"A\":[\"B\"]}],\"performers\":[" + performer("A", "") + "]}";

        GraphModel model = builder.build(EnsembleSpecJson.fromJson(json));

        assertEquals(List.of("B"), model.getDependencies("A"));
        assertNull(model.getPerformer("B"));
    }

    @Test
    void build_missingRequiredFieldNamesPerformer() {
        String json = "{\"guid\":\"e\",\"performers\":[{\"guid\":\"X\",\"backoff\":0,"
                + "\"source\":{\"name\":\"x.jar\",\"classPath\":\"com.acme.X\"}}]}";

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> builder.build(EnsembleSpecJson.fromJson(json)));
        assertTrue(e.getMessage().contains("X"));
        assertTrue(e.getMessage().contains("schedule"));
    }

    @Test
    void build_rejectsNegativeAutoScale() {
        String json = "{\"guid\":\"e\",\"performers\":[" + performer("P", ",\"autoScale\":-1") + "]}";

        assertThrows(IllegalArgumentException.class, () -> builder.build(EnsembleSpecJson.fromJson(json)));
    }

    @Test
    void describe_rendersEdgesAndNodes() {
        String json = "{\"guid\":\"e\",\"connections\":[{\"A\":[\"B\",\"C\"]}],\"performers\":["
                + performer("A", "") + "," + performer("B", "") + "," + performer("C", "") + "]}";

        GraphModel model = builder.build(EnsembleSpecJson.fromJson(json));

        assertEquals(" \t A : [B,C]", model.describeEdges());
        assertEquals("[A,B,C]", model.describeNodes());
    }
}
