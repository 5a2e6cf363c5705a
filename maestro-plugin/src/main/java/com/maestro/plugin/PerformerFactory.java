package com.maestro.plugin;

/**
 * Creates performer instances. The same factory is used for the first instance and for every
 * restart, so each call must return a fresh instance.
 */
@FunctionalInterface
public interface PerformerFactory {

    Performer create() throws Exception;
}
