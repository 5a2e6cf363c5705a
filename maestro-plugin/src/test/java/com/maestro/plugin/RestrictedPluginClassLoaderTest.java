package com.maestro.plugin;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RestrictedPluginClassLoaderTest {

    @Test
    void exposesPlatformPerformerApiAndLogging() throws Exception {
        RestrictedPluginClassLoader loader = new RestrictedPluginClassLoader();

        assertSame(String.class, loader.loadClass("java.lang.String"));
        assertSame(Performer.class, loader.loadClass(Performer.class.getName()));
        assertSame(org.slf4j.Logger.class, loader.loadClass("org.slf4j.Logger"));
    }

    @Test
    void hidesEverythingElse() {
        RestrictedPluginClassLoader loader = new RestrictedPluginClassLoader();

        ClassNotFoundException e = assertThrows(ClassNotFoundException.class,
                () -> loader.loadClass("org.junit.jupiter.api.Test"));
        assertTrue(e.getMessage().contains("not visible to performer jars"));
        assertFalse(RestrictedPluginClassLoader.isAllowed("com.maestro.runtime.dispatch.Dispatcher"));
        assertFalse(RestrictedPluginClassLoader.isAllowed("com.maestro.pluginx.Sneaky"));
        assertTrue(RestrictedPluginClassLoader.isAllowed("com.maestro.plugin.PerformerRef"));
    }
}
