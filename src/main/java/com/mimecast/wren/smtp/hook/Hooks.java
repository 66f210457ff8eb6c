package com.mimecast.wren.smtp.hook;

import com.mimecast.wren.smtp.session.Session;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Immutable per-session view of registered handlers.
 *
 * <p>Typed accessors match the registration methods of {@link HookRegistry}.
 */
@SuppressWarnings("unchecked")
public final class Hooks {

    private final Map<HookEvent, HookHandler<?, ?>> handlers;
    private final List<Consumer<Session>> endObservers;

    /**
     * Constructs a new Hooks instance.
     *
     * @param handlers     Handlers by event.
     * @param endObservers End observers.
     */
    Hooks(Map<HookEvent, HookHandler<?, ?>> handlers, List<Consumer<Session>> endObservers) {
        this.handlers = handlers.isEmpty() ? Collections.emptyMap() : Collections.unmodifiableMap(new EnumMap<>(handlers));
        this.endObservers = List.copyOf(endObservers);
    }

    /**
     * Hooks with nothing registered.
     *
     * @return Hooks instance.
     */
    public static Hooks none() {
        return new Hooks(Collections.emptyMap(), Collections.emptyList());
    }

    /**
     * Is handler registered.
     *
     * @param event HookEvent.
     * @return Boolean.
     */
    public boolean has(HookEvent event) {
        return handlers.containsKey(event);
    }

    /**
     * Gets registered events.
     *
     * @return Set of HookEvent.
     */
    public Set<HookEvent> getEvents() {
        return handlers.isEmpty() ? EnumSet.noneOf(HookEvent.class) : EnumSet.copyOf(handlers.keySet());
    }

    public Optional<HookHandler<String, Void>> connect() {
        return get(HookEvent.CONNECT);
    }

    public Optional<HookHandler<String, List<String>>> ehlo() {
        return get(HookEvent.EHLO);
    }

    public Optional<HookHandler<String, Void>> helo() {
        return get(HookEvent.HELO);
    }

    public Optional<HookHandler<String, String>> mailFrom() {
        return get(HookEvent.MAIL_FROM);
    }

    public Optional<HookHandler<String, String>> rcptTo() {
        return get(HookEvent.RCPT_TO);
    }

    public Optional<HookHandler<Void, Void>> data() {
        return get(HookEvent.DATA);
    }

    public Optional<HookHandler<byte[], Void>> dataAvailable() {
        return get(HookEvent.DATA_AVAILABLE);
    }

    public Optional<HookHandler<byte[], Void>> dataEnd() {
        return get(HookEvent.DATA_END);
    }

    /**
     * Gets end observers.
     *
     * @return List of Consumer.
     */
    public List<Consumer<Session>> getEndObservers() {
        return endObservers;
    }

    private <T, R> Optional<HookHandler<T, R>> get(HookEvent event) {
        return Optional.ofNullable((HookHandler<T, R>) handlers.get(event));
    }
}
