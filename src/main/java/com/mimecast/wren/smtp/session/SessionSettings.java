package com.mimecast.wren.smtp.session;

import com.mimecast.wren.config.server.ListenerConfig;
import com.mimecast.wren.config.server.ServerConfig;

/**
 * Startup parameters a session needs.
 */
@SuppressWarnings("UnusedReturnValue")
public class SessionSettings {

    /**
     * Hostname used in replies.
     */
    private String hostname = "example.com";

    /**
     * Greeting banner text.
     */
    private String banner = "Wren";

    /**
     * Body size limit in bytes, 0 for unlimited.
     */
    private long emailSizeLimit = 0L;

    /**
     * Command line length limit in bytes, 0 for unlimited.
     */
    private int maxLineLength = 0;

    /**
     * Seconds a continuation may stay unresolved, 0 to wait forever.
     */
    private long hookTimeout = 0L;

    /**
     * Builds settings from configuration.
     *
     * @param server   ServerConfig instance.
     * @param listener ListenerConfig instance.
     * @return SessionSettings instance.
     */
    public static SessionSettings from(ServerConfig server, ListenerConfig listener) {
        return new SessionSettings()
                .setHostname(server.getHostname())
                .setBanner(server.getBanner())
                .setEmailSizeLimit(listener.getEmailSizeLimit())
                .setMaxLineLength(listener.getMaxLineLength())
                .setHookTimeout(listener.getHookTimeout());
    }

    public String getHostname() {
        return hostname;
    }

    public SessionSettings setHostname(String hostname) {
        this.hostname = hostname;
        return this;
    }

    public String getBanner() {
        return banner;
    }

    public SessionSettings setBanner(String banner) {
        this.banner = banner;
        return this;
    }

    public long getEmailSizeLimit() {
        return emailSizeLimit;
    }

    public SessionSettings setEmailSizeLimit(long emailSizeLimit) {
        this.emailSizeLimit = emailSizeLimit;
        return this;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public SessionSettings setMaxLineLength(int maxLineLength) {
        this.maxLineLength = maxLineLength;
        return this;
    }

    public long getHookTimeout() {
        return hookTimeout;
    }

    public SessionSettings setHookTimeout(long hookTimeout) {
        this.hookTimeout = hookTimeout;
        return this;
    }
}
