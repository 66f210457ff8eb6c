package com.mimecast.wren.smtp.session;

/**
 * Greeting received from the client.
 */
public enum GreetingKind {
    NONE,
    HELO,
    EHLO
}
