package com.mimecast.wren.main;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration foundation initializer.
 *
 * <p>Loads {@code server.json5} from a configuration directory into {@link Config}.
 */
public abstract class Foundation {
    protected static final Logger log = LogManager.getLogger(Foundation.class);

    /**
     * Server configuration filename.
     */
    public static final String SERVER_CONFIG = "server.json5";

    /**
     * Initializes configuration.
     *
     * @param path Directory path.
     * @throws ConfigurationException Unable to read or parse configuration.
     */
    public static void init(String path) throws ConfigurationException {
        Path file = Paths.get(path, SERVER_CONFIG);
        if (!Files.isReadable(file)) {
            throw new ConfigurationException("Server configuration not found: " + file);
        }

        try {
            Config.initServer(file.toString());
            log.info("Loaded server configuration from {}", file);
        } catch (IOException e) {
            ConfigurationException exception = new ConfigurationException("Unable to load " + file + ": " + e.getMessage());
            exception.setRootCause(e);
            throw exception;
        }
    }
}
