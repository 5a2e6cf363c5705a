package com.maestro.plugin;

/**
 * Marker for messages that control-aware workers handle before ordinary traffic.
 */
public interface ControlMessage {
}
