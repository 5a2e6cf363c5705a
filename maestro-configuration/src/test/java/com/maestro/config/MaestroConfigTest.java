package com.maestro.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MaestroConfigTest {

    @Test
    void builder_appliesDefaults() {
        MaestroConfig config = MaestroConfig.builder().build();

        assertEquals(3, config.getMaxRestarts());
        assertEquals(Duration.ofMinutes(1), config.getRestartWindow());
        assertEquals(500, config.getMessagesPerResize());
        assertEquals(0.4, config.getBacklogThreshold());
        assertEquals(0.1, config.getBackoffThreshold());
        assertEquals("/opt/maestro/jars", config.getJarRepository());
        assertEquals("/opt/maestro/dynamic-jars", config.getDynamicJarRepository());
        assertTrue(config.getWorkerThreads() >= 2);
        assertTrue(config.isMetricsEnabled());
    }

    @Test
    void builder_nullRepositoryFallsBackToDefault() {
        MaestroConfig config = MaestroConfig.builder()
                .jarRepository(null)
                .dynamicJarRepository("/tmp/dyn")
                .build();

        assertEquals("/opt/maestro/jars", config.getJarRepository());
        assertEquals("/tmp/dyn", config.getDynamicJarRepository());
    }

    @Test
    void build_rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> MaestroConfig.builder().messagesPerResize(0).build());
        assertThrows(IllegalArgumentException.class, () -> MaestroConfig.builder().maxRestarts(-1).build());
        assertThrows(IllegalArgumentException.class, () -> MaestroConfig.builder().restartWindow(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> MaestroConfig.builder().backlogThreshold(1.5).build());
        assertThrows(IllegalArgumentException.class,
                () -> MaestroConfig.builder().backlogThreshold(0.4).backoffThreshold(0.5).build());
    }

    @Test
    void fromEnvironment_returnsValidConfig() {
        MaestroConfig config = MaestroConfig.fromEnvironment();

        assertTrue(config.getMaxRestarts() >= 0);
        assertTrue(config.getMailboxCapacity() >= 1);
    }
}
