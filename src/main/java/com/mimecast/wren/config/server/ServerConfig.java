package com.mimecast.wren.config.server;

import com.mimecast.wren.config.ConfigFoundation;

import java.io.IOException;
import java.util.Map;

/**
 * Server configuration.
 *
 * <p>This class provides type safe access to server configuration.
 * <p>Values are opaque startup parameters; only hostname, banner and listener limits reach sessions.
 */
public class ServerConfig extends ConfigFoundation {

    /**
     * Constructs a new ServerConfig instance.
     */
    public ServerConfig() {
        super();
    }

    /**
     * Constructs a new ServerConfig instance.
     *
     * @param map Configuration map.
     */
    public ServerConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ServerConfig instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ServerConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets hostname used in replies.
     *
     * @return Hostname.
     */
    public String getHostname() {
        return getStringProperty("hostname", "example.com");
    }

    /**
     * Gets greeting banner.
     *
     * @return Banner string.
     */
    public String getBanner() {
        return getStringProperty("banner", "Wren");
    }

    /**
     * Gets bind address.
     *
     * @return Bind address string.
     */
    public String getBind() {
        return getStringProperty("bind", "::");
    }

    /**
     * Gets SMTP port.
     * <p>Zero disables the listener.
     *
     * @return Port number.
     */
    public int getSmtpPort() {
        return Math.toIntExact(getLongProperty("smtpPort", 25L));
    }

    /**
     * Gets SMTP port listener configuration.
     *
     * @return ListenerConfig instance.
     */
    public ListenerConfig getSmtpConfig() {
        return new ListenerConfig(getMapProperty("smtpConfig"));
    }
}
