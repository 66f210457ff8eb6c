package com.mimecast.wren.smtp.hook;

import java.util.Arrays;
import java.util.Optional;

/**
 * Protocol milestones an embedding application may intercept.
 */
public enum HookEvent {
    CONNECT("connect"),
    EHLO("ehlo"),
    HELO("helo"),
    MAIL_FROM("mail_from"),
    RCPT_TO("rcpt_to"),
    DATA("data"),
    DATA_AVAILABLE("data_available"),
    DATA_END("data_end");

    private final String eventName;

    HookEvent(String eventName) {
        this.eventName = eventName;
    }

    /**
     * Gets event name.
     *
     * @return Event name string.
     */
    public String getEventName() {
        return eventName;
    }

    /**
     * Finds event by name.
     *
     * @param name Event name.
     * @return Optional of HookEvent.
     */
    public static Optional<HookEvent> fromName(String name) {
        return Arrays.stream(values())
                .filter(event -> event.eventName.equalsIgnoreCase(name))
                .findFirst();
    }
}
