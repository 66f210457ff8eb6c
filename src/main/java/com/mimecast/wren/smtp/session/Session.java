package com.mimecast.wren.smtp.session;

import com.mimecast.wren.smtp.SmtpResponses;
import com.mimecast.wren.smtp.connection.Connection;
import com.mimecast.wren.smtp.hook.Continuation;
import com.mimecast.wren.smtp.hook.HookEvent;
import com.mimecast.wren.smtp.hook.HookHandler;
import com.mimecast.wren.smtp.hook.Hooks;
import com.mimecast.wren.smtp.hook.Rejection;
import com.mimecast.wren.smtp.hook.Resolution;
import com.mimecast.wren.smtp.metrics.SmtpMetrics;
import com.mimecast.wren.smtp.verb.AddressPolicy;
import com.mimecast.wren.smtp.verb.Arguments;
import com.mimecast.wren.smtp.verb.Verb;
import com.mimecast.wren.smtp.verb.VerbRecognizer;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * SMTP session.
 *
 * <p>Holds the protocol state of one client connection and drives replies.
 * <br>The transport pushes bytes in with {@link #receive(byte[])} and reports {@link #end()} or {@link #error(Throwable)}.
 *
 * <p>Every milestone is offered to the matching registered {@link HookHandler}; without one the built-in default applies.
 * <br>While a continuation is outstanding all further input is queued and not interpreted,
 * so commands and body chunks are processed strictly in arrival order
 * and streaming body handlers never see overlapping invocations.
 *
 * <p>All state changes happen under the session monitor; continuations may be resolved from any thread.
 */
public class Session {
    private static final Logger log = LogManager.getLogger(Session.class);

    /**
     * Logging context key.
     */
    private static final String UID_KEY = "uid";

    private final String uid = UUID.randomUUID().toString();
    private final Connection connection;
    private final Hooks hooks;
    private final SessionSettings settings;

    /**
     * Hook timeout scheduler, null when timeouts are not used.
     */
    private final ScheduledExecutorService scheduler;

    private SessionState state = SessionState.INIT;
    private GreetingKind greetingKind = GreetingKind.NONE;
    private String heloHost;
    private String fromAddress;
    private String rawMailFrom;
    private final List<String> recipients = new ArrayList<>();

    /**
     * Bytes of the command line being read.
     */
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream();
    private boolean lineOverflow = false;

    /**
     * Body state, set from the 354 reply until the transaction ends.
     */
    private BodyAccumulator accumulator;

    /**
     * Last accepted body.
     */
    private byte[] body;

    /**
     * Received bytes not yet interpreted.
     */
    private final Deque<byte[]> inbound = new ArrayDeque<>();

    private Continuation<?> pending;
    private ScheduledFuture<?> pendingTimeout;
    private boolean draining = false;

    /**
     * Constructs a new Session instance without hook timeouts.
     *
     * @param connection Connection instance.
     * @param hooks      Hooks snapshot.
     * @param settings   SessionSettings instance.
     */
    public Session(Connection connection, Hooks hooks, SessionSettings settings) {
        this(connection, hooks, settings, null);
    }

    /**
     * Constructs a new Session instance.
     *
     * @param connection Connection instance.
     * @param hooks      Hooks snapshot.
     * @param settings   SessionSettings instance.
     * @param scheduler  Scheduler for hook timeouts or null.
     */
    public Session(Connection connection, Hooks hooks, SessionSettings settings, ScheduledExecutorService scheduler) {
        this.connection = connection;
        this.hooks = hooks;
        this.settings = settings;
        this.scheduler = scheduler;
    }

    // ========== Transport events ==========

    /**
     * Starts the dialogue by sending the greeting, or offering the connection to the connect hook.
     */
    public synchronized void start() {
        inContext(() -> {
            if (state != SessionState.INIT) {
                return;
            }

            SmtpMetrics.incrementSessionStart();
            log.info("Session started for {}", connection.getRemoteAddress());

            Optional<HookHandler<String, Void>> hook = hooks.connect();
            if (hook.isPresent()) {
                dispatch(HookEvent.CONNECT, hook.get(), connection.getRemoteAddress(),
                        ignored -> greeting(),
                        () -> state = SessionState.AWAIT_COMMAND);
            } else {
                greeting();
            }
        });
    }

    /**
     * Receives a chunk of bytes from the transport.
     *
     * @param chunk Bytes as read, copied before use.
     */
    public synchronized void receive(byte[] chunk) {
        inContext(() -> {
            if (state == SessionState.CLOSED) {
                log.debug("Ignoring {} bytes received after close", chunk.length);
                return;
            }
            if (chunk.length == 0) {
                return;
            }

            inbound.add(chunk.clone());
            drain();
        });
    }

    /**
     * End of stream from the peer.
     */
    public synchronized void end() {
        inContext(() -> terminate("end of stream"));
    }

    /**
     * Transport failure.
     *
     * @param e Throwable instance.
     */
    public synchronized void error(Throwable e) {
        inContext(() -> {
            if (state != SessionState.CLOSED) {
                log.info("Transport error: {}", e.getMessage());
            }
            terminate("transport error");
        });
    }

    // ========== Input processing ==========

    /**
     * Interprets queued input until it runs out or a continuation is outstanding.
     */
    private void drain() {
        if (draining) {
            return;
        }

        draining = true;
        try {
            while (pending == null && !inbound.isEmpty() &&
                    (state == SessionState.AWAIT_COMMAND || state == SessionState.IN_DATA)) {
                byte[] chunk = inbound.poll();
                if (state == SessionState.IN_DATA) {
                    consumeBody(chunk);
                } else {
                    consumeCommand(chunk);
                }
            }
        } finally {
            draining = false;
        }
    }

    /**
     * Reads up to one command line from chunk and processes it.
     * <p>Bytes after the line go back to the front of the queue.
     *
     * @param chunk Byte array.
     */
    private void consumeCommand(byte[] chunk) {
        int maxLineLength = settings.getMaxLineLength();

        for (int i = 0; i < chunk.length; i++) {
            if (!lineOverflow) {
                lineBuffer.write(chunk[i]);
            }

            if (chunk[i] == '\n') {
                if (i + 1 < chunk.length) {
                    inbound.addFirst(Arrays.copyOfRange(chunk, i + 1, chunk.length));
                }

                String line = lineBuffer.toString(StandardCharsets.UTF_8);
                boolean overflowed = lineOverflow;
                lineBuffer.reset();
                lineOverflow = false;

                if (overflowed) {
                    log.info("Discarded command line over {} bytes", maxLineLength);
                    send(SmtpResponses.LINE_TOO_LONG_500);
                } else {
                    processLine(line);
                }
                return;
            }

            // A carriage return may still turn out to be part of the terminator.
            int content = lineBuffer.size() - (chunk[i] == '\r' ? 1 : 0);
            if (!lineOverflow && maxLineLength > 0 && content > maxLineLength) {
                lineOverflow = true;
                lineBuffer.reset();
            }
        }
    }

    /**
     * Dispatches one command line.
     *
     * @param line Line including terminator.
     */
    private void processLine(String line) {
        Verb verb = VerbRecognizer.recognize(line);
        log.debug("RCV: {} [{}]", StringUtils.stripEnd(line, "\r\n"), verb);

        switch (verb) {
            case EHLO -> ehlo(line);
            case HELO -> helo(line);
            case MAIL_FROM -> mailFrom(line);
            case RCPT_TO -> rcptTo(line);
            case DATA -> data();
            case QUIT -> quit();
            case NOOP -> send(SmtpResponses.OK_250);
            case RSET -> rset();
            default -> notSupported();
        }
    }

    // ========== Commands ==========

    private void greeting() {
        state = SessionState.AWAIT_COMMAND;
        send(String.format(SmtpResponses.GREETING_220, settings.getHostname(), settings.getBanner()));
    }

    private void ehlo(String line) {
        String host = Arguments.extract(Verb.EHLO, line);

        Optional<HookHandler<String, List<String>>> hook = hooks.ehlo();
        if (hook.isPresent()) {
            dispatch(HookEvent.EHLO, hook.get(), host, capabilities -> {
                greet(GreetingKind.EHLO, host);
                sendEhlo(capabilities.orElse(Collections.emptyList()));
            });
        } else {
            greet(GreetingKind.EHLO, host);
            sendEhlo(Collections.emptyList());
        }
    }

    private void sendEhlo(List<String> capabilities) {
        send(String.format(SmtpResponses.HELLO_250_MULTILINE, settings.getHostname(), connection.getRemoteAddress()));
        for (String capability : capabilities) {
            send(SmtpResponses.ADVERT_250_MULTILINE + capability);
        }
        send(SmtpResponses.ADVERT_250_LAST + SmtpResponses.EIGHTBITMIME);
    }

    private void helo(String line) {
        String host = Arguments.extract(Verb.HELO, line);
        String reply = String.format(SmtpResponses.HELLO_250, settings.getHostname(), connection.getRemoteAddress());

        Optional<HookHandler<String, Void>> hook = hooks.helo();
        if (hook.isPresent()) {
            dispatch(HookEvent.HELO, hook.get(), host, ignored -> {
                greet(GreetingKind.HELO, host);
                send(reply);
            });
        } else {
            greet(GreetingKind.HELO, host);
            send(reply);
        }
    }

    /**
     * Records the greeting; a repeated greeting also drops any open transaction.
     * <p>The greeting kind is set by the first greeting only, the host by every one.
     */
    private void greet(GreetingKind kind, String host) {
        if (greetingKind == GreetingKind.NONE) {
            greetingKind = kind;
        }
        heloHost = host;
        endTransaction();
    }

    private void mailFrom(String line) {
        if (heloHost == null) {
            send(SmtpResponses.NEED_GREETING_503);
            return;
        }

        String raw = Arguments.extract(Verb.MAIL_FROM, line);
        String address = Arguments.stripBrackets(raw);

        // Handlers decide on the sender themselves, null reverse-path included.
        Optional<HookHandler<String, String>> hook = hooks.mailFrom();
        if (hook.isPresent()) {
            rawMailFrom = raw;
            dispatch(HookEvent.MAIL_FROM, hook.get(), address, override -> {
                fromAddress = override.orElse(address);
                send(SmtpResponses.OK_250);
            });
            return;
        }

        if (!AddressPolicy.isAcceptable(address)) {
            send(SmtpResponses.INVALID_ADDRESS_501);
            return;
        }

        rawMailFrom = raw;
        fromAddress = address;
        send(SmtpResponses.OK_250);
    }

    private void rcptTo(String line) {
        if (fromAddress == null) {
            send(SmtpResponses.NEED_SENDER_503);
            return;
        }

        String address = Arguments.stripBrackets(Arguments.extract(Verb.RCPT_TO, line));
        if (!AddressPolicy.isAcceptable(address)) {
            send(SmtpResponses.INVALID_ADDRESS_501);
            return;
        }

        Optional<HookHandler<String, String>> hook = hooks.rcptTo();
        if (hook.isPresent()) {
            dispatch(HookEvent.RCPT_TO, hook.get(), address, override -> {
                recipients.add(override.orElse(address));
                send(SmtpResponses.OK_250);
            });
        } else {
            recipients.add(address);
            send(SmtpResponses.OK_250);
        }
    }

    private void data() {
        if (recipients.isEmpty()) {
            send(SmtpResponses.NEED_RECIPIENT_503);
            return;
        }

        Optional<HookHandler<Void, Void>> hook = hooks.data();
        if (hook.isPresent()) {
            dispatch(HookEvent.DATA, hook.get(), null, ignored -> startData());
        } else {
            startData();
        }
    }

    private void startData() {
        accumulator = new BodyAccumulator(!hooks.has(HookEvent.DATA_AVAILABLE), settings.getEmailSizeLimit());
        body = null;
        state = SessionState.IN_DATA;
        send(SmtpResponses.START_INPUT_354);
    }

    private void rset() {
        endTransaction();
        body = null;
        send(SmtpResponses.OK_250);
    }

    private void quit() {
        send(String.format(SmtpResponses.CLOSING_221, settings.getHostname()));
        terminate("quit");
    }

    private void notSupported() {
        SmtpMetrics.incrementUnrecognized();
        send(SmtpResponses.NOT_SUPPORTED_500);
    }

    // ========== Body ==========

    /**
     * Feeds one chunk to the accumulator.
     * <p>Bytes after the terminator go back to the front of the queue as command input.
     *
     * @param chunk Byte array.
     */
    private void consumeBody(byte[] chunk) {
        BodyAccumulator.Feed feed = accumulator.feed(chunk);
        if (feed.getRemainder().length > 0) {
            inbound.addFirst(feed.getRemainder());
        }

        Optional<HookHandler<byte[], Void>> stream = hooks.dataAvailable();
        if (stream.isPresent() && feed.getAvailable().length > 0) {
            BodyAccumulator current = accumulator;
            dispatch(HookEvent.DATA_AVAILABLE, stream.get(), feed.getAvailable(),
                    ignored -> {
                        if (feed.isComplete()) {
                            finishData();
                        }
                    },
                    () -> {
                        current.discard();
                        if (feed.isComplete()) {
                            finishData();
                        }
                    });
        } else if (feed.isComplete()) {
            finishData();
        }
    }

    /**
     * Terminator found and any streamed bytes handed over.
     */
    private void finishData() {
        BodyAccumulator finished = accumulator;
        state = SessionState.AWAIT_COMMAND;

        // Rejected by the streaming handler which already got its reply out.
        if (finished.isDiscarded()) {
            endTransaction();
            return;
        }

        if (finished.isOverflow()) {
            log.info("Message of {} bytes over limit of {}", finished.getSize(), settings.getEmailSizeLimit());
            endTransaction();
            send(SmtpResponses.SIZE_EXCEEDED_552);
            return;
        }

        byte[] message = finished.getBody();
        Optional<HookHandler<byte[], Void>> hook = hooks.dataEnd();
        if (hook.isPresent()) {
            dispatch(HookEvent.DATA_END, hook.get(), message, ignored -> acceptMessage(message), this::endTransaction);
        } else {
            acceptMessage(message);
        }
    }

    private void acceptMessage(byte[] message) {
        log.info("Accepted message of {} bytes from {} for {} recipients", message.length, fromAddress, recipients.size());
        body = message;
        endTransaction();
        SmtpMetrics.incrementMessageAccepted();
        send(SmtpResponses.OK_250);
    }

    /**
     * Drops envelope and body state, keeps the greeting.
     */
    private void endTransaction() {
        accumulator = null;
        fromAddress = null;
        rawMailFrom = null;
        recipients.clear();
    }

    // ========== Hooks ==========

    private <T, R> void dispatch(HookEvent event, HookHandler<T, R> handler, T value, Consumer<Optional<R>> onAccept) {
        dispatch(event, handler, value, onAccept, () -> {
        });
    }

    /**
     * Offers a milestone to its handler and suspends input until the continuation resolves.
     *
     * @param event    HookEvent.
     * @param handler  HookHandler instance.
     * @param value    Value offered.
     * @param onAccept Default effect, given the override if any.
     * @param onReject Cleanup after the rejection reply.
     * @param <T>      Value type.
     * @param <R>      Override type.
     */
    private <T, R> void dispatch(HookEvent event, HookHandler<T, R> handler, T value,
                                 Consumer<Optional<R>> onAccept, Runnable onReject) {
        Continuation<R> continuation = new Continuation<>(event,
                resolution -> onResolution(event, resolution, onAccept, onReject));
        pending = continuation;
        scheduleTimeout(continuation);

        log.debug("Dispatching {} hook", event.getEventName());
        try {
            handler.handle(value, continuation, this);
        } catch (RuntimeException e) {
            log.error("Hook {} failed: {}", event.getEventName(), e.getMessage(), e);
            continuation.resolveIfPending(Resolution.rejected(
                    new Rejection(SmtpResponses.INTERNAL_ERROR_MESSAGE, SmtpResponses.INTERNAL_ERROR_451, false)));
        }
    }

    private synchronized <R> void onResolution(HookEvent event, Resolution<R> resolution,
                                               Consumer<Optional<R>> onAccept, Runnable onReject) {
        inContext(() -> {
            if (pending == null || state == SessionState.CLOSED) {
                log.debug("Ignoring {} hook resolution on closed session", event.getEventName());
                return;
            }

            pending = null;
            cancelTimeout();
            log.debug("Hook {} {}", event.getEventName(), resolution);

            if (resolution.isAccepted()) {
                onAccept.accept(resolution.getOverride());
            } else {
                Rejection rejection = resolution.getRejection();
                SmtpMetrics.incrementHookRejection(event.getEventName());
                send(rejection.toReply());
                onReject.run();
                if (rejection.close()) {
                    quit();
                }
            }

            drain();
        });
    }

    private void scheduleTimeout(Continuation<?> continuation) {
        long timeout = settings.getHookTimeout();
        if (timeout <= 0 || scheduler == null) {
            return;
        }

        try {
            pendingTimeout = scheduler.schedule(() -> continuation.expire(
                            new Rejection(SmtpResponses.HOOK_TIMEOUT_MESSAGE, SmtpResponses.INTERNAL_ERROR_451, true)),
                    timeout, TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Unable to schedule hook timeout: {}", e.getMessage());
        }
    }

    private void cancelTimeout() {
        if (pendingTimeout != null) {
            pendingTimeout.cancel(false);
            pendingTimeout = null;
        }
    }

    // ========== Output and termination ==========

    private void send(String line) {
        if (state == SessionState.CLOSED) {
            return;
        }

        log.debug("SND: {}", line);
        try {
            connection.write(line);
        } catch (IOException e) {
            log.info("Error writing: {}", e.getMessage());
            terminate("write failure");
        }
    }

    /**
     * Moves to CLOSED exactly once, closes the connection and notifies end observers.
     *
     * @param reason Reason for logging.
     */
    private void terminate(String reason) {
        if (state == SessionState.CLOSED) {
            return;
        }

        state = SessionState.CLOSED;
        inbound.clear();
        lineBuffer.reset();
        accumulator = null;
        pending = null;
        cancelTimeout();

        connection.close();
        log.info("Session ended: {}", reason);
        SmtpMetrics.incrementSessionEnd();

        for (Consumer<Session> observer : hooks.getEndObservers()) {
            try {
                observer.accept(this);
            } catch (RuntimeException e) {
                log.error("End observer failed: {}", e.getMessage(), e);
            }
        }
    }

    private void inContext(Runnable action) {
        String previous = ThreadContext.get(UID_KEY);
        ThreadContext.put(UID_KEY, uid);
        try {
            action.run();
        } finally {
            if (previous != null) {
                ThreadContext.put(UID_KEY, previous);
            } else {
                ThreadContext.remove(UID_KEY);
            }
        }
    }

    // ========== Accessors ==========

    public String getUID() {
        return uid;
    }

    public synchronized SessionState getState() {
        return state;
    }

    public synchronized GreetingKind getGreetingKind() {
        return greetingKind;
    }

    /**
     * Is ESMTP mode, set by EHLO.
     *
     * @return Boolean.
     */
    public synchronized boolean isEsmtp() {
        return greetingKind == GreetingKind.EHLO;
    }

    /**
     * Gets HELO/EHLO argument.
     *
     * @return Hostname string or null before greeting.
     */
    public synchronized String getHeloHost() {
        return heloHost;
    }

    /**
     * Gets accepted sender.
     *
     * @return Address string or null when absent.
     */
    public synchronized String getFromAddress() {
        return fromAddress;
    }

    /**
     * Gets the MAIL FROM argument as sent, angle brackets and parameters included.
     *
     * @return String or null.
     */
    public synchronized String getRawMailFrom() {
        return rawMailFrom;
    }

    /**
     * Gets accepted recipients in acceptance order.
     *
     * @return Unmodifiable list copy.
     */
    public synchronized List<String> getRecipients() {
        return List.copyOf(recipients);
    }

    /**
     * Gets last accepted body without the terminator.
     * <p>Empty when it was streamed, null before the first accepted body or after RSET.
     *
     * @return Byte array or null.
     */
    public synchronized byte[] getBody() {
        return body != null ? body.clone() : null;
    }

    public synchronized boolean isInData() {
        return state == SessionState.IN_DATA;
    }

    /**
     * Is a continuation outstanding.
     *
     * @return Boolean.
     */
    public synchronized boolean isSuspended() {
        return pending != null;
    }

    public String getRemoteAddress() {
        return connection.getRemoteAddress();
    }

    /**
     * Gets events with a registered handler.
     *
     * @return Set of HookEvent.
     */
    public Set<HookEvent> getRegisteredHooks() {
        return hooks.getEvents();
    }
}
