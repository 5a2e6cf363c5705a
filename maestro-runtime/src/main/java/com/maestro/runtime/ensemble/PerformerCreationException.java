package com.maestro.runtime.ensemble;

/**
 * The performer class could not be loaded or its first instance could not be created.
 */
public final class PerformerCreationException extends EnsembleBuildException {

    private final String classPath;
    private final String jarName;

    public PerformerCreationException(String performerId, String classPath, String jarName, Throwable cause) {
        super(performerId, String.format("Could not create performer %s (class=%s, jar=%s): %s",
                performerId, classPath, jarName, cause != null ? cause.getMessage() : "unknown"), cause);
        this.classPath = classPath;
        this.jarName = jarName;
    }

    public String getClassPath() {
        return classPath;
    }

    public String getJarName() {
        return jarName;
    }
}
