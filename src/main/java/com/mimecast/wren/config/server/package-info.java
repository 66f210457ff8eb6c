/**
 * Server configuration.
 *
 * <p>{@link com.mimecast.wren.config.server.ServerConfig} maps {@code server.json5}.
 * <br>{@link com.mimecast.wren.config.server.ListenerConfig} maps the listener section within it.
 */
package com.mimecast.wren.config.server;
