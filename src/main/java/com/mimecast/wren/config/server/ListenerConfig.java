package com.mimecast.wren.config.server;

import com.mimecast.wren.config.ConfigFoundation;

import java.util.Map;

/**
 * Listener configuration.
 *
 * <p>This class provides type safe access to listener-specific configuration.
 */
public class ListenerConfig extends ConfigFoundation {

    /**
     * Constructs a new ListenerConfig instance.
     */
    public ListenerConfig() {
        super();
    }

    /**
     * Constructs a new ListenerConfig instance with configuration map.
     *
     * @param map Configuration map.
     */
    public ListenerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Gets backlog size.
     *
     * @return Backlog size.
     */
    public int getBacklog() {
        return Math.toIntExact(getLongProperty("backlog", 25L));
    }

    /**
     * Gets minimum pool size.
     *
     * @return Thread pool min size.
     */
    public int getMinimumPoolSize() {
        return Math.toIntExact(getLongProperty("minimumPoolSize", 1L));
    }

    /**
     * Gets maximum pool size.
     * <p>Each connection holds one thread for its lifetime.
     *
     * @return Thread pool max size.
     */
    public int getMaximumPoolSize() {
        return Math.toIntExact(getLongProperty("maximumPoolSize", 10L));
    }

    /**
     * Gets thread keep alive time.
     *
     * @return Time in seconds.
     */
    public int getThreadKeepAliveTime() {
        return Math.toIntExact(getLongProperty("threadKeepAliveTime", 60L));
    }

    /**
     * Gets socket read buffer size.
     *
     * @return Size in bytes.
     */
    public int getReadBufferSize() {
        return Math.toIntExact(getLongProperty("readBufferSize", 8192L));
    }

    /**
     * Gets email size limit.
     * <p>Bodies over this size are read to the end and refused with 552.
     *
     * @return Size in bytes, 0 for unlimited.
     */
    public long getEmailSizeLimit() {
        return getLongProperty("emailSizeLimit", 0L);
    }

    /**
     * Gets command line length limit.
     * <p>Counts the line content only, the CRLF terminator is not included.
     *
     * @return Size in bytes, 0 for unlimited.
     */
    public int getMaxLineLength() {
        return Math.toIntExact(getLongProperty("maxLineLength", 0L));
    }

    /**
     * Gets hook timeout.
     * <p>A continuation unresolved for longer is rejected with 451 and the connection closed.
     *
     * @return Time in seconds, 0 to wait forever.
     */
    public long getHookTimeout() {
        return getLongProperty("hookTimeout", 0L);
    }
}
