package com.mimecast.wren.smtp.session;

/**
 * Session lifecycle states.
 *
 * <p>{@code INIT -> AWAIT_COMMAND <-> IN_DATA}, any state {@code -> CLOSED}.
 */
public enum SessionState {
    /**
     * Connected, greeting not yet sent.
     */
    INIT,

    /**
     * Reading command lines.
     */
    AWAIT_COMMAND,

    /**
     * Reading message body, between the 354 reply and the terminator.
     */
    IN_DATA,

    /**
     * Terminated, no further processing.
     */
    CLOSED
}
