package com.mimecast.wren.smtp;

import com.mimecast.wren.config.server.ListenerConfig;
import com.mimecast.wren.smtp.connection.SocketConnection;
import com.mimecast.wren.smtp.session.Session;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.util.Arrays;

/**
 * Email receipt runnable.
 *
 * <p>This is used to create threads for incoming connections.
 * <p>A new instance will be constructed for every socket connection the server receives.
 * <br>It pumps socket reads into a {@link Session} until end of stream, a transport error or the session closing.
 */
public class EmailReceipt implements Runnable {
    private static final Logger log = LogManager.getLogger(EmailReceipt.class);

    private final Socket socket;
    private final SmtpServer server;
    private final ListenerConfig config;

    /**
     * Constructs a new EmailReceipt instance.
     *
     * @param socket Inbound socket.
     * @param server SmtpServer instance.
     * @param config Listener configuration instance.
     */
    public EmailReceipt(Socket socket, SmtpServer server, ListenerConfig config) {
        this.socket = socket;
        this.server = server;
        this.config = config;
    }

    /**
     * Server receipt runner.
     */
    @Override
    public void run() {
        SocketConnection connection;
        try {
            connection = new SocketConnection(socket);
        } catch (IOException e) {
            log.info("Error initializing streams: {}", e.getMessage());
            closeQuietly();
            return;
        }

        Session session = server.onConnection(connection, config);
        session.start();

        byte[] buffer = new byte[config.getReadBufferSize()];
        try {
            InputStream inputStream = connection.getInputStream();
            int read;
            while (connection.isOpen() && (read = inputStream.read(buffer)) != -1) {
                session.receive(Arrays.copyOf(buffer, read));
            }
            session.end();

        } catch (IOException e) {
            // Reads fail once the session closed the socket itself.
            session.error(e);

        } finally {
            connection.close();
        }
    }

    private void closeQuietly() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing socket: {}", e.getMessage());
        }
    }
}
