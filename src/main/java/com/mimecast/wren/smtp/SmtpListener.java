package com.mimecast.wren.smtp;

import com.mimecast.wren.config.server.ListenerConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * SMTP socket listener for handling client connections.
 * <p>This class runs a {@link ServerSocket} bound to a configured network interface and port.
 * <p>For each accepted connection, it creates an {@link EmailReceipt} instance to handle the SMTP session.
 * <p>It uses a {@link ThreadPoolExecutor} to manage concurrent connections.
 *
 * @see EmailReceipt
 * @see SmtpServer
 */
public class SmtpListener {
    private static final Logger log = LogManager.getLogger(SmtpListener.class);

    /**
     * The underlying server socket that listens for incoming connections.
     */
    private volatile ServerSocket listener;

    /**
     * Thread pool for handling client connections.
     */
    private final ThreadPoolExecutor executor;

    /**
     * Flag to indicate a server shutdown is in progress.
     */
    private volatile boolean serverShutdown = false;

    /**
     * Released once the socket is bound or binding failed.
     */
    private final CountDownLatch ready = new CountDownLatch(1);

    private final int port;
    private final String bind;
    private final ListenerConfig config;
    private final SmtpServer server;

    /**
     * Constructs a new SmtpListener instance with the specified configuration.
     *
     * @param port   The port number to listen on, 0 for an ephemeral port.
     * @param bind   The network interface address to bind to.
     * @param config The {@link ListenerConfig} containing listener-specific settings.
     * @param server The {@link SmtpServer} creating sessions.
     */
    public SmtpListener(int port, String bind, ListenerConfig config, SmtpServer server) {
        this.port = port;
        this.bind = bind;
        this.config = config;
        this.server = server;

        this.executor = new ThreadPoolExecutor(
                config.getMinimumPoolSize(),
                config.getMaximumPoolSize(),
                config.getThreadKeepAliveTime(), TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    /**
     * Starts the listener.
     * <p>This method opens the server socket and enters a loop to accept incoming connections.
     */
    public void listen() {
        try {
            listener = new ServerSocket(port, config.getBacklog(), InetAddress.getByName(bind));
            log.info("Listening to [{}]:{}", bind, listener.getLocalPort());
            ready.countDown();

            acceptConnection();

        } catch (IOException e) {
            log.fatal("Error listening: {}", e.getMessage());

        } finally {
            ready.countDown();
            try {
                if (listener != null && !listener.isClosed()) {
                    listener.close();
                    log.info("Closed listener for port {}.", port);
                }
                executor.shutdown();
            } catch (Exception e) {
                log.info("Listener for port {} already closed.", port);
            }
        }
    }

    /**
     * Accepts incoming connections in a loop until a shutdown is initiated.
     */
    private void acceptConnection() {
        try {
            do {
                Socket sock = listener.accept();
                log.info("Accepted connection from {}:{} on port {}.", sock.getInetAddress().getHostAddress(), sock.getPort(), getPort());

                executor.submit(() -> {
                    try {
                        new EmailReceipt(sock, server, config).run();

                    } catch (Exception e) {
                        log.error("Email receipt unexpected exception: {}", e.getMessage());
                    }
                    return null;
                });
            } while (!serverShutdown);

        } catch (SocketException e) {
            if (!serverShutdown) {
                log.info("Error in socket exchange: {}", e.getMessage());
            }
        } catch (IOException e) {
            log.info("Error reading/writing: {}", e.getMessage());
        }
    }

    /**
     * Waits for the socket to be bound.
     *
     * @param timeout Timeout in milliseconds.
     * @return True if bound.
     * @throws InterruptedException Interrupted while waiting.
     */
    public boolean awaitReady(long timeout) throws InterruptedException {
        return ready.await(timeout, TimeUnit.MILLISECONDS) && listener != null && listener.isBound();
    }

    /**
     * Initiates a graceful shutdown of the listener.
     *
     * @throws IOException If an I/O error occurs when closing the socket.
     */
    public void serverShutdown() throws IOException {
        serverShutdown = true;
        if (listener != null) {
            listener.close();
        }
        executor.shutdown();
    }

    /**
     * Gets the port number, the bound one once listening.
     *
     * @return The port number.
     */
    public int getPort() {
        return listener != null ? listener.getLocalPort() : port;
    }
}
