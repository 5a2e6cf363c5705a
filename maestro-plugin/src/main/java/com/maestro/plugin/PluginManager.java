package com.maestro.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central plugin manager: internal performers registered by class name (part of the application
 * classpath) and performer jars loaded through a {@link JarPluginLoader}. Internal registrations are
 * consulted first; the jar is only opened when no internal factory matches the class name.
 */
public final class PluginManager implements PluginLoader, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final Map<String, PerformerFactory> internalFactories = new ConcurrentHashMap<>();
    private final JarPluginLoader jarLoader;

    public PluginManager() {
        this(new JarPluginLoader());
    }

    public PluginManager(JarPluginLoader jarLoader) {
        this.jarLoader = Objects.requireNonNull(jarLoader, "jarLoader");
    }

    /**
     * Registers an internal performer factory under a class name. A later registration replaces an earlier one.
     */
    public void registerInternal(String classPath, PerformerFactory factory) {
        Objects.requireNonNull(classPath, "classPath");
        Objects.requireNonNull(factory, "factory");
        PerformerFactory previous = internalFactories.put(classPath, factory);
        if (previous != null) {
            log.warn("Internal performer {} registered twice; keeping the latest", classPath);
        }
    }

    /**
     * Registers an internal performer class; instances are created through its public no-arg constructor.
     *
     * @throws IllegalArgumentException if the class has no public no-arg constructor
     */
    public void registerInternal(Class<? extends Performer> performerClass) {
        try {
            var ctor = JarPluginLoader.performerConstructor(performerClass, performerClass.getName(), null);
            registerInternal(performerClass.getName(), () -> JarPluginLoader.newInstance(ctor));
        } catch (LoadError e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    @Override
    public PerformerFactory load(String classPath, Path artifactLocation, String artifactName) throws LoadError {
        PerformerFactory internal = classPath != null ? internalFactories.get(classPath) : null;
        if (internal != null) {
            log.debug("Resolved performer {} from internal registrations", classPath);
            return internal;
        }
        return jarLoader.load(classPath, artifactLocation, artifactName);
    }

    public Set<String> getInternalClassNames() {
        return Set.copyOf(internalFactories.keySet());
    }

    /** Number of internal registrations. */
    public int getInternalCount() {
        return internalFactories.size();
    }

    @Override
    public void close() {
        jarLoader.close();
    }
}
