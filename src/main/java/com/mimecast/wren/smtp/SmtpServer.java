package com.mimecast.wren.smtp;

import com.mimecast.wren.config.server.ListenerConfig;
import com.mimecast.wren.config.server.ServerConfig;
import com.mimecast.wren.smtp.connection.Connection;
import com.mimecast.wren.smtp.hook.HookRegistry;
import com.mimecast.wren.smtp.session.Session;
import com.mimecast.wren.smtp.session.SessionSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * SMTP server.
 *
 * <p>Owns the hook registry and creates one {@link Session} per connection.
 * <br>Handlers are registered before or while running; each session sees the handlers registered when it was created.
 *
 * <h2>Example:</h2>
 * <pre>
 *     SmtpServer server = new SmtpServer(Config.getServer());
 *     server.getHooks()
 *             .onMailFrom((address, continuation, session) -&gt; continuation.accept())
 *             .onDataEnd((body, continuation, session) -&gt; {
 *                 store(session.getRecipients(), body);
 *                 continuation.accept();
 *             });
 *     server.start();
 * </pre>
 */
public class SmtpServer {
    private static final Logger log = LogManager.getLogger(SmtpServer.class);

    private final ServerConfig config;
    private final HookRegistry hooks = new HookRegistry();

    /**
     * Hook timeout scheduler.
     */
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "wren-hook-timeout");
        thread.setDaemon(true);
        return thread;
    });

    private SmtpListener listener;
    private Thread listenerThread;

    /**
     * Constructs a new SmtpServer instance.
     *
     * @param config ServerConfig instance.
     */
    public SmtpServer(ServerConfig config) {
        this.config = config;
    }

    /**
     * Gets hook registry.
     *
     * @return HookRegistry instance.
     */
    public HookRegistry getHooks() {
        return hooks;
    }

    /**
     * Gets config.
     *
     * @return ServerConfig instance.
     */
    public ServerConfig getConfig() {
        return config;
    }

    /**
     * Creates the session for a new connection.
     *
     * @param connection     Connection instance.
     * @param listenerConfig Listener configuration of the accepting port.
     * @return Session instance, not yet started.
     */
    public Session onConnection(Connection connection, ListenerConfig listenerConfig) {
        return new Session(connection, hooks.snapshot(), SessionSettings.from(config, listenerConfig), scheduler);
    }

    /**
     * Starts listening in a background thread.
     * <p>A configured port of 0 binds an ephemeral port, see {@link SmtpListener#getPort()}.
     */
    public synchronized void start() {
        if (listener != null) {
            return;
        }
        listener = new SmtpListener(config.getSmtpPort(), config.getBind(), config.getSmtpConfig(), this);
        listenerThread = new Thread(listener::listen, "wren-listener");
        listenerThread.start();
        log.info("Started SMTP server {} with hooks {}", config.getHostname(), hooks.snapshot().getEvents());
    }

    /**
     * Gets listener.
     *
     * @return SmtpListener or null before start.
     */
    public synchronized SmtpListener getListener() {
        return listener;
    }

    /**
     * Stops listening and cancels pending hook timeouts.
     */
    public synchronized void stop() {
        try {
            if (listener != null) {
                listener.serverShutdown();
            }
        } catch (Exception e) {
            log.info("Listener already closed: {}", e.getMessage());
        }
        scheduler.shutdownNow();
        listener = null;
        listenerThread = null;
    }
}
