package com.mimecast.wren.smtp.connection;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

/**
 * Socket backed connection.
 */
public class SocketConnection implements Connection {
    private static final Logger log = LogManager.getLogger(SocketConnection.class);

    /**
     * Line terminator.
     */
    private static final byte[] CRLF = {'\r', '\n'};

    private final Socket socket;
    private final InputStream inputStream;
    private final OutputStream outputStream;
    private final String remoteAddress;
    private volatile boolean open = true;

    /**
     * Constructs a new SocketConnection instance.
     *
     * @param socket Accepted socket.
     * @throws IOException Unable to open streams.
     */
    public SocketConnection(Socket socket) throws IOException {
        this.socket = socket;
        this.inputStream = socket.getInputStream();
        this.outputStream = socket.getOutputStream();
        this.remoteAddress = socket.getInetAddress().getHostAddress();
    }

    @Override
    public String getRemoteAddress() {
        return remoteAddress;
    }

    /**
     * Gets input stream.
     *
     * @return InputStream instance.
     */
    public InputStream getInputStream() {
        return inputStream;
    }

    @Override
    public synchronized void write(String line) throws IOException {
        if (!open) {
            return;
        }

        outputStream.write(line.getBytes(StandardCharsets.UTF_8));
        outputStream.write(CRLF);
        outputStream.flush();
    }

    @Override
    public synchronized void close() {
        if (!open) {
            return;
        }
        open = false;

        try {
            socket.close();
            log.info("Closed connection to {}", remoteAddress);
        } catch (IOException e) {
            log.info("Error closing socket: {}", e.getMessage());
        }
    }

    @Override
    public boolean isOpen() {
        return open && !socket.isClosed();
    }
}
