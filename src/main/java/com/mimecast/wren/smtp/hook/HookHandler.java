package com.mimecast.wren.smtp.hook;

import com.mimecast.wren.smtp.session.Session;

/**
 * Handler for a protocol milestone.
 *
 * <p>The session suspends the current command until the continuation is resolved exactly once.
 * <br>Resolution may happen on any thread, before or after this method returns.
 * <br>Implementations must not block waiting for another thread to resolve the continuation
 * as the session is locked for the duration of the call.
 * <p>A continuation left unresolved stalls its session until the listener's hook timeout, if any, expires.
 *
 * @param <T> Value type offered to the handler.
 * @param <R> Override type the handler may accept with.
 */
@FunctionalInterface
public interface HookHandler<T, R> {

    /**
     * Handles the milestone.
     *
     * @param value        Parsed argument, chunk or body.
     * @param continuation Single-use accept/reject handle.
     * @param session      Session instance.
     */
    void handle(T value, Continuation<R> continuation, Session session);
}
