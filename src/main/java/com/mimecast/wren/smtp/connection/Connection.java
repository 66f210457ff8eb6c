package com.mimecast.wren.smtp.connection;

import java.io.IOException;

/**
 * Outbound side of a client connection as seen by a session.
 *
 * <p>Inbound bytes are pushed into the session by the transport.
 *
 * @see SocketConnection
 */
public interface Connection {

    /**
     * Gets peer address.
     *
     * @return Address string.
     */
    String getRemoteAddress();

    /**
     * Writes one reply line followed by CRLF.
     *
     * @param line Reply line without terminator.
     * @throws IOException Unable to communicate.
     */
    void write(String line) throws IOException;

    /**
     * Closes the connection.
     * <p>Must be idempotent.
     */
    void close();

    /**
     * Is open.
     *
     * @return Boolean.
     */
    boolean isOpen();
}
