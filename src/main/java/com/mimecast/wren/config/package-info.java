/**
 * Configuration foundation.
 *
 * <p>Configuration files are JSON5 documents exposed through {@link com.mimecast.wren.config.ConfigFoundation}.
 * <br>Server specific configuration lives in {@link com.mimecast.wren.config.server}.
 */
package com.mimecast.wren.config;
