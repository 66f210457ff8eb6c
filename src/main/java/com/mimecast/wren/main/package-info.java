/**
 * Process entry and configuration container.
 *
 * <p>{@link com.mimecast.wren.main.Server#run(String)} loads configuration from a directory and starts listening.
 */
package com.mimecast.wren.main;
