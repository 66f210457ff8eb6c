package com.mimecast.wren.main;

import com.mimecast.wren.config.server.ServerConfig;
import com.mimecast.wren.metrics.MetricsRegistry;
import com.mimecast.wren.smtp.SmtpServer;
import com.mimecast.wren.smtp.metrics.SmtpMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import javax.naming.ConfigurationException;

/**
 * Main server class.
 *
 * <p>This class is responsible for initializing and managing the server's lifecycle.
 * <p>It loads configuration, registers metrics and starts the SMTP listener.
 * <p>The standalone server runs without hooks, so every milestone takes its built-in default.
 * Embedding applications use {@link SmtpServer} directly and register hooks on it.
 *
 * @see SmtpServer
 * @see Foundation
 */
public class Server extends Foundation {

    /**
     * Running server.
     */
    private static SmtpServer smtpServer;

    /**
     * Initializes and starts the server.
     *
     * @param path The directory path containing the configuration files.
     * @return SmtpServer instance.
     * @throws ConfigurationException If there is an issue with the configuration files.
     */
    public static synchronized SmtpServer run(String path) throws ConfigurationException {
        init(path);

        MetricsRegistry.register(new SimpleMeterRegistry());
        SmtpMetrics.initialize();

        ServerConfig serverConfig = Config.getServer();
        smtpServer = new SmtpServer(serverConfig);

        // Port 0 disables the standalone listener.
        if (serverConfig.getSmtpPort() != 0) {
            smtpServer.start();
        } else {
            log.warn("SMTP port disabled, nothing to listen on");
        }

        registerShutdownHook();
        return smtpServer;
    }

    /**
     * Registers a JVM shutdown hook for graceful termination.
     */
    private static void registerShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(Server::shutdown, "wren-shutdown"));
    }

    /**
     * Stops the listener and logs session counters.
     */
    public static synchronized void shutdown() {
        if (smtpServer == null) {
            return;
        }

        log.info("Shutting down");
        smtpServer.stop();
        smtpServer = null;

        MeterRegistry registry = MetricsRegistry.getRegistry();
        if (registry != null) {
            for (String name : new String[]{SmtpMetrics.SESSION_START, SmtpMetrics.MESSAGE_ACCEPTED}) {
                Counter counter = registry.find(name).counter();
                log.info("{}: {}", name, counter != null ? (long) counter.count() : 0L);
            }
        }
    }
}
