package com.scholary.voice.protocol;

/**
 * Marker for typed messages pushed by the server over the streaming connection.
 *
 * <p>Each inbound frame maps to exactly one variant, chosen by the top-level key of the JSON
 * object.
 */
public interface ServerEvent {}
