package com.maestro.plugin;

import java.nio.file.Path;

/**
 * Resolves a performer class reference to a {@link PerformerFactory}.
 */
public interface PluginLoader {

    /**
     * @param classPath        fully qualified performer class name
     * @param artifactLocation repository directory that holds the artifact
     * @param artifactName     artifact (jar) file name within the location
     * @return factory producing fresh instances of the class
     * @throws LoadError when the class cannot be resolved
     */
    PerformerFactory load(String classPath, Path artifactLocation, String artifactName) throws LoadError;
}
