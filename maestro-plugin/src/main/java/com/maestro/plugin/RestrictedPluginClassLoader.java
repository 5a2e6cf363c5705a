package com.maestro.plugin;

import java.util.List;

/**
 * Parent of every performer jar's class loader. A performer jar sees the JDK, the performer API in
 * this package and SLF4J; any other name, such as a supervisor, the dispatcher or a telemetry sink,
 * resolves to {@link ClassNotFoundException}. Looking a runtime class up by name from a performer
 * ({@code Class.forName}) fails the same way.
 */
public final class RestrictedPluginClassLoader extends ClassLoader {

    static final List<String> VISIBLE_PREFIXES = List.of("java.", "javax.", "com.maestro.plugin.", "org.slf4j.");

    private final ClassLoader host;

    /** Visible classes come from the loader of the performer API. */
    public RestrictedPluginClassLoader() {
        this(Performer.class.getClassLoader());
    }

    RestrictedPluginClassLoader(ClassLoader host) {
        super(null);
        this.host = host;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (!isAllowed(name)) {
            throw new ClassNotFoundException(name + " is not visible to performer jars; visible prefixes: "
                    + VISIBLE_PREFIXES);
        }
        synchronized (getClassLoadingLock(name)) {
            Class<?> loaded = host.loadClass(name);
            if (resolve) {
                resolveClass(loaded);
            }
            return loaded;
        }
    }

    static boolean isAllowed(String name) {
        for (String prefix : VISIBLE_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
