package com.mimecast.wren.smtp.connection;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection mock recording replies.
 */
public class ConnectionMock implements Connection {

    private final StringBuilder stringBuilder;
    private final List<String> lines = new ArrayList<>();
    private volatile boolean open = true;
    private int closeCount = 0;
    private boolean failWrites = false;

    /**
     * Constructs a new ConnectionMock instance.
     *
     * @param stringBuilder StringBuilder receiving written lines.
     */
    public ConnectionMock(StringBuilder stringBuilder) {
        this.stringBuilder = stringBuilder;
    }

    @Override
    public String getRemoteAddress() {
        return "127.0.0.1";
    }

    @Override
    public synchronized void write(String line) throws IOException {
        if (failWrites) {
            throw new IOException("Broken pipe");
        }
        stringBuilder.append(line).append("\r\n");
    }

    @Override
    public synchronized void close() {
        closeCount++;
        open = false;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    /**
     * Splits written output into lines.
     */
    public synchronized void parseLines() {
        lines.clear();
        for (String line : stringBuilder.toString().split("(?<=\r\n)")) {
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
    }

    /**
     * Gets line by number.
     *
     * @param number Line number starting from 1.
     * @return Line including CRLF.
     */
    public synchronized String getLine(int number) {
        return lines.get(number - 1);
    }

    /**
     * Gets parsed lines.
     *
     * @return List of String.
     */
    public synchronized List<String> getLines() {
        return new ArrayList<>(lines);
    }

    public synchronized int getCloseCount() {
        return closeCount;
    }

    /**
     * Makes every following write fail.
     */
    public synchronized void failWrites() {
        failWrites = true;
    }
}
