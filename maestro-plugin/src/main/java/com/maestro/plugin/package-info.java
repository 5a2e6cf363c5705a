/**
 * Performer contract and plugin loading.
 * <ul>
 *   <li>{@link com.maestro.plugin.Performer} – hooks a supervised worker invokes: onStart, onMessage, onTick, onStop</li>
 *   <li>{@link com.maestro.plugin.PerformerContext} – parameters, schedule, backoff, connections and identifiers</li>
 *   <li>{@link com.maestro.plugin.PerformerRef} – asynchronous reference to a live worker</li>
 *   <li>{@link com.maestro.plugin.ControlMessage} – marker for messages handled first by control-aware workers</li>
 *   <li>{@link com.maestro.plugin.PluginLoader} / {@link com.maestro.plugin.PerformerFactory} – class reference to fresh instances</li>
 *   <li>{@link com.maestro.plugin.JarPluginLoader} – jar loading behind {@link com.maestro.plugin.RestrictedPluginClassLoader}</li>
 *   <li>{@link com.maestro.plugin.PluginManager} – internal registrations first, then jars</li>
 * </ul>
 */
package com.maestro.plugin;
