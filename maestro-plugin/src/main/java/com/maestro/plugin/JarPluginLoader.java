package com.maestro.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads performer classes from jar files. Each jar gets one {@link URLClassLoader} whose parent is a
 * {@link RestrictedPluginClassLoader}; loaders are cached by absolute jar path and closed by {@link #close()}.
 * The loaded class must implement {@link Performer} and expose a public no-arg constructor.
 */
public final class JarPluginLoader implements PluginLoader, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JarPluginLoader.class);

    private final Map<Path, URLClassLoader> loaders = new ConcurrentHashMap<>();
    private volatile boolean closed;

    @Override
    public PerformerFactory load(String classPath, Path artifactLocation, String artifactName) throws LoadError {
        if (closed) {
            throw new LoadError("Plugin loader is closed", classPath, artifactName);
        }
        if (classPath == null || classPath.isBlank()) {
            throw new LoadError("No performer class given", classPath, artifactName);
        }
        if (artifactName == null || artifactName.isBlank()) {
            throw new LoadError("No jar name given for " + classPath, classPath, artifactName);
        }
        Path jar = (artifactLocation != null ? artifactLocation.resolve(artifactName) : Path.of(artifactName))
                .toAbsolutePath().normalize();
        if (!Files.isRegularFile(jar)) {
            throw new LoadError("Jar not found: " + jar, classPath, artifactName);
        }
        URLClassLoader loader = loaderFor(jar, classPath, artifactName);
        Class<?> clazz;
        try {
            clazz = Class.forName(classPath, false, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new LoadError("Could not load class " + classPath + " from jar " + jar, classPath, artifactName, e);
        }
        Constructor<? extends Performer> ctor = performerConstructor(clazz, classPath, artifactName);
        log.info("Loaded performer class {} from jar {}", classPath, jar);
        return () -> newInstance(ctor);
    }

    /**
     * Validates that the class is a concrete {@link Performer} with a public no-arg constructor.
     */
    static Constructor<? extends Performer> performerConstructor(Class<?> clazz, String classPath, String artifactName)
            throws LoadError {
        if (!Performer.class.isAssignableFrom(clazz)) {
            throw new LoadError("Class " + classPath + " does not implement " + Performer.class.getName(),
                    classPath, artifactName);
        }
        if (clazz.isInterface() || Modifier.isAbstract(clazz.getModifiers())) {
            throw new LoadError("Class " + classPath + " is not concrete", classPath, artifactName);
        }
        try {
            return clazz.asSubclass(Performer.class).getConstructor();
        } catch (NoSuchMethodException e) {
            throw new LoadError("Class " + classPath + " has no public no-arg constructor", classPath, artifactName, e);
        } catch (LinkageError e) {
            throw new LoadError("Class " + classPath + " could not be linked: " + e, classPath, artifactName, e);
        }
    }

    static Performer newInstance(Constructor<? extends Performer> ctor) throws Exception {
        try {
            return ctor.newInstance();
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }

    private URLClassLoader loaderFor(Path jar, String classPath, String artifactName) throws LoadError {
        URLClassLoader existing = loaders.get(jar);
        if (existing != null) {
            return existing;
        }
        URL url;
        try {
            url = jar.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new LoadError("Invalid jar path " + jar, classPath, artifactName, e);
        }
        URLClassLoader created = new URLClassLoader(new URL[]{url}, new RestrictedPluginClassLoader());
        URLClassLoader raced = loaders.putIfAbsent(jar, created);
        if (raced != null) {
            closeQuietly(jar, created);
            return raced;
        }
        log.debug("Opened class loader for jar {}", jar);
        return created;
    }

    /** Number of jars with an open class loader. */
    public int getLoadedJarCount() {
        return loaders.size();
    }

    @Override
    public void close() {
        closed = true;
        List<Path> jars = new ArrayList<>(loaders.keySet());
        for (Path jar : jars) {
            URLClassLoader loader = loaders.remove(jar);
            if (loader != null) closeQuietly(jar, loader);
        }
    }

    private static void closeQuietly(Path jar, URLClassLoader loader) {
        try {
            loader.close();
        } catch (IOException e) {
            log.warn("Failed to close class loader for jar {}: {}", jar, e.getMessage());
        }
    }
}
