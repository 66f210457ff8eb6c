package com.mimecast.wren.smtp.hook;

import com.mimecast.wren.smtp.session.Session;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Server wide handler registry.
 *
 * <p>One handler per event; registering again replaces the previous handler.
 * <br>Sessions take a {@link Hooks} snapshot at construction so later registrations only affect new connections.
 *
 * <h2>Example:</h2>
 * <pre>
 *     registry.onRcptTo((address, continuation, session) -&gt; {
 *         if (address.endsWith("@example.com")) {
 *             continuation.accept();
 *         } else {
 *             continuation.reject("relay denied", false, 550);
 *         }
 *     });
 * </pre>
 */
public class HookRegistry {

    private final Map<HookEvent, HookHandler<?, ?>> handlers = new EnumMap<>(HookEvent.class);
    private final List<Consumer<Session>> endObservers = new ArrayList<>();

    /**
     * Registers connect handler.
     * <p>Offered the peer address; accepting sends the greeting.
     *
     * @param handler HookHandler instance.
     * @return Self.
     */
    public HookRegistry onConnect(HookHandler<String, Void> handler) {
        return put(HookEvent.CONNECT, handler);
    }

    /**
     * Registers EHLO handler.
     * <p>Offered the client hostname; accepting may supply extra capability lines.
     *
     * @param handler HookHandler instance.
     * @return Self.
     */
    public HookRegistry onEhlo(HookHandler<String, List<String>> handler) {
        return put(HookEvent.EHLO, handler);
    }

    /**
     * Registers HELO handler.
     *
     * @param handler HookHandler instance.
     * @return Self.
     */
    public HookRegistry onHelo(HookHandler<String, Void> handler) {
        return put(HookEvent.HELO, handler);
    }

    /**
     * Registers MAIL FROM handler.
     * <p>Offered the sender without angle brackets, not shape checked; accepting may override it.
     *
     * @param handler HookHandler instance.
     * @return Self.
     */
    public HookRegistry onMailFrom(HookHandler<String, String> handler) {
        return put(HookEvent.MAIL_FROM, handler);
    }

    /**
     * Registers RCPT TO handler.
     * <p>Offered the shape checked recipient; accepting may override it.
     *
     * @param handler HookHandler instance.
     * @return Self.
     */
    public HookRegistry onRcptTo(HookHandler<String, String> handler) {
        return put(HookEvent.RCPT_TO, handler);
    }

    /**
     * Registers DATA handler.
     * <p>Offered nothing; accepting sends the 354 continuation reply.
     *
     * @param handler HookHandler instance.
     * @return Self.
     */
    public HookRegistry onData(HookHandler<Void, Void> handler) {
        return put(HookEvent.DATA, handler);
    }

    /**
     * Registers streaming body handler.
     * <p>Offered body bytes as they arrive; the session stops buffering the body.
     *
     * @param handler HookHandler instance.
     * @return Self.
     */
    public HookRegistry onDataAvailable(HookHandler<byte[], Void> handler) {
        return put(HookEvent.DATA_AVAILABLE, handler);
    }

    /**
     * Registers end of body handler.
     * <p>Offered the whole body, or an empty array when streaming.
     *
     * @param handler HookHandler instance.
     * @return Self.
     */
    public HookRegistry onDataEnd(HookHandler<byte[], Void> handler) {
        return put(HookEvent.DATA_END, handler);
    }

    /**
     * Registers session end observer.
     * <p>Called once per session on QUIT, end of stream, transport error or handler requested close.
     *
     * @param observer Consumer of Session.
     * @return Self.
     */
    public synchronized HookRegistry onEnd(Consumer<Session> observer) {
        endObservers.add(observer);
        return this;
    }

    /**
     * Removes handler.
     *
     * @param event HookEvent.
     * @return Self.
     */
    public synchronized HookRegistry remove(HookEvent event) {
        handlers.remove(event);
        return this;
    }

    /**
     * Is handler registered.
     *
     * @param event HookEvent.
     * @return Boolean.
     */
    public synchronized boolean isRegistered(HookEvent event) {
        return handlers.containsKey(event);
    }

    /**
     * Takes immutable snapshot for a new session.
     *
     * @return Hooks instance.
     */
    public synchronized Hooks snapshot() {
        return new Hooks(handlers, endObservers);
    }

    private synchronized HookRegistry put(HookEvent event, HookHandler<?, ?> handler) {
        if (handler == null) {
            throw new IllegalArgumentException("Handler for " + event.getEventName() + " must not be null");
        }
        handlers.put(event, handler);
        return this;
    }
}
