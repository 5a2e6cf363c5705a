package com.maestro.bootstrap;

import com.maestro.bootstrap.performers.EchoPerformer;
import com.maestro.plugin.PluginManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the {@link PluginManager} used by the process: built-in performers registered by class name,
 * everything else loaded from plugin jars.
 */
public final class InternalPerformers {

    private static final Logger log = LoggerFactory.getLogger(InternalPerformers.class);

    private InternalPerformers() {
    }

    public static PluginManager createPluginManager() {
        PluginManager pluginManager = new PluginManager();
        pluginManager.registerInternal(EchoPerformer.class);
        log.info("Performers: {} internal {}", pluginManager.getInternalCount(), pluginManager.getInternalClassNames());
        return pluginManager;
    }
}
