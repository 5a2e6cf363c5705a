package com.maestro.plugin;

/**
 * Checked failure to resolve a performer class from a plugin artifact: missing jar, unknown class,
 * class that does not implement {@link Performer}, or no public no-arg constructor.
 */
public class LoadError extends Exception {

    private final String classPath;
    private final String artifactName;

    public LoadError(String message, String classPath, String artifactName) {
        super(message);
        this.classPath = classPath;
        this.artifactName = artifactName;
    }

    public LoadError(String message, String classPath, String artifactName, Throwable cause) {
        super(message, cause);
        this.classPath = classPath;
        this.artifactName = artifactName;
    }

    public String getClassPath() {
        return classPath;
    }

    public String getArtifactName() {
        return artifactName;
    }
}
