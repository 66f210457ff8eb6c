package com.mimecast.wren.smtp.hook;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Single-use accept/reject handle given to a {@link HookHandler}.
 *
 * <p>Resolving twice throws {@link IllegalStateException} and has no effect on the session.
 * <br>A continuation expired by the hook timeout ignores any later resolution.
 *
 * @param <R> Override type.
 */
public class Continuation<R> {
    private static final Logger log = LogManager.getLogger(Continuation.class);

    private final HookEvent event;
    private final Consumer<Resolution<R>> target;
    private final AtomicBoolean resolved = new AtomicBoolean(false);
    private volatile boolean expired = false;

    /**
     * Constructs a new Continuation instance.
     *
     * @param event  Event this continuation belongs to.
     * @param target Receiver of the resolution.
     */
    public Continuation(HookEvent event, Consumer<Resolution<R>> target) {
        this.event = event;
        this.target = target;
    }

    /**
     * Gets event.
     *
     * @return HookEvent.
     */
    public HookEvent getEvent() {
        return event;
    }

    /**
     * Accepts without override.
     */
    public void accept() {
        accept(null);
    }

    /**
     * Accepts with override value used in place of the parsed argument.
     *
     * @param override Override value or null.
     */
    public void accept(R override) {
        resolve(Resolution.accepted(override));
    }

    /**
     * Rejects with default status and keeps the connection open.
     *
     * @param message Reply text.
     */
    public void reject(String message) {
        reject(message, false, Rejection.DEFAULT_STATUS);
    }

    /**
     * Rejects with default status.
     *
     * @param message Reply text.
     * @param close   Close the connection after replying.
     */
    public void reject(String message, boolean close) {
        reject(message, close, Rejection.DEFAULT_STATUS);
    }

    /**
     * Rejects.
     *
     * @param message    Reply text.
     * @param close      Close the connection after replying.
     * @param statusCode SMTP status code.
     */
    public void reject(String message, boolean close, int statusCode) {
        resolve(Resolution.rejected(new Rejection(message, statusCode, close)));
    }

    /**
     * Is resolved.
     *
     * @return Boolean.
     */
    public boolean isResolved() {
        return resolved.get();
    }

    /**
     * Resolves unless already resolved.
     * <p>Used by the session for timeouts and handler failures.
     *
     * @param resolution Resolution instance.
     * @return True if this call resolved the continuation.
     */
    public boolean resolveIfPending(Resolution<R> resolution) {
        if (resolved.compareAndSet(false, true)) {
            target.accept(resolution);
            return true;
        }
        return false;
    }

    /**
     * Expires this continuation with given rejection.
     *
     * @param rejection Rejection instance.
     */
    public void expire(Rejection rejection) {
        if (resolved.compareAndSet(false, true)) {
            expired = true;
            log.warn("Hook {} expired unresolved", event.getEventName());
            target.accept(Resolution.rejected(rejection));
        }
    }

    private void resolve(Resolution<R> resolution) {
        if (!resolved.compareAndSet(false, true)) {
            if (expired) {
                log.warn("Ignoring late resolution of expired hook {}: {}", event.getEventName(), resolution);
                return;
            }
            throw new IllegalStateException("Continuation already resolved for " + event.getEventName());
        }
        target.accept(resolution);
    }
}
