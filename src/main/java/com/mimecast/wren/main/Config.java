package com.mimecast.wren.main;

import com.mimecast.wren.config.server.ServerConfig;

import java.io.IOException;

/**
 * Master configuration container.
 *
 * <p>ServerConfig configuration holds the hostname, bind address, port and listener limits.
 *
 * @see ServerConfig
 */
public class Config {

    /**
     * Protected constructor.
     */
    private Config() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Server configuration.
     */
    private static ServerConfig server = new ServerConfig();

    /**
     * Gets server config.
     *
     * @return ServerConfig.
     */
    public static ServerConfig getServer() {
        return server;
    }

    /**
     * Init server config.
     *
     * @param path File path.
     * @throws IOException Unable to read file.
     */
    public static void initServer(String path) throws IOException {
        server = new ServerConfig(path);
    }
}
