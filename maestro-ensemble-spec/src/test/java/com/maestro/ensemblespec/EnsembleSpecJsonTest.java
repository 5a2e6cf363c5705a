package com.maestro.ensemblespec;

import com.maestro.ensemblespec.model.EnsembleDefinition;
import com.maestro.ensemblespec.model.PerformerDefinition;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnsembleSpecJsonTest {

    private static final String SAMPLE = """
            {
              "guid": "ens-1",
              "command": "CREATE",
              "connections": [ { "B": ["C"], "A": ["B", "C"] } ],
              "performers": [
                { "guid": "A", "schedule": 0, "backoff": 0,
                  "source": { "name": "a.jar", "classPath": "com.acme.A", "parameters": {} } },
                { "guid": "B", "schedule": 100, "backoff": 5, "autoScale": 3,
                  "source": { "name": "b.jar", "classPath": "com.acme.B", "parameters": { "k": "v" } } },
                { "guid": "C", "schedule": 0, "backoff": 0, "controlAware": true, "extra": 1,
                  "source": { "name": "c.jar", "classPath": "com.acme.C", "parameters": {},
                              "location": { "url": "https://repo/c.jar" } } }
              ]
            }
            """;

    @Test
    void fromJson_readsAllFields() {
        EnsembleDefinition def = EnsembleSpecJson.fromJson(SAMPLE);

        assertEquals("ens-1", def.getGuid());
        assertEquals("CREATE", def.getCommand());
        assertEquals(1, def.getConnections().size());
        assertEquals(List.of("B", "A"), List.copyOf(def.getConnections().get(0).keySet()));
        assertEquals(List.of("B", "C"), def.getConnections().get(0).get("A"));

        PerformerDefinition b = def.getPerformers().get(1);
        assertEquals("B", b.getGuid());
        assertEquals(100, b.getSchedule());
        assertEquals(3, b.getAutoScale());
        assertNull(b.getControlAware());
        assertEquals("v", b.getSource().getParameters().get("k"));
        assertFalse(b.getSource().hasExplicitLocation());

        PerformerDefinition c = def.getPerformers().get(2);
        assertTrue(c.getControlAware());
        assertTrue(c.getSource().hasExplicitLocation());
    }

    @Test
    void fromJson_missingCollectionsBecomeEmpty() {
        EnsembleDefinition def = EnsembleSpecJson.fromJson("{\"guid\":\"e\"}");

        assertTrue(def.getConnections().isEmpty());
        assertTrue(def.getPerformers().isEmpty());
    }

    @Test
    void fromJson_malformedThrowsUnchecked() {
        assertThrows(UncheckedIOException.class, () -> EnsembleSpecJson.fromJson("{\"guid\": "));
    }

    @Test
    void toJson_omitsNullsAndReadsBackEqual() {
        EnsembleDefinition def = EnsembleSpecJson.fromJson(SAMPLE);

        String json = EnsembleSpecJson.toJson(def);

        assertFalse(json.contains("null"));
        assertEquals(def, EnsembleSpecJson.fromJson(json));
    }
}
