package com.mimecast.wren.smtp.metrics;

import com.mimecast.wren.metrics.MetricsRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * SMTP-related Micrometer metrics.
 *
 * <p>Provides counters for session lifecycle, accepted messages and rejections.
 * <br>Failures to record are logged and never propagate to the session.
 */
public final class SmtpMetrics {
    private static final Logger log = LogManager.getLogger(SmtpMetrics.class);

    public static final String SESSION_START = "wren.session.start";
    public static final String SESSION_END = "wren.session.end";
    public static final String MESSAGE_ACCEPTED = "wren.message.accepted";
    public static final String HOOK_REJECTION = "wren.hook.rejection";
    public static final String COMMAND_UNRECOGNIZED = "wren.command.unrecognized";

    /**
     * Private constructor for utility class.
     */
    private SmtpMetrics() {
    }

    /**
     * Initialize counters with zero values so they appear before any traffic.
     */
    public static void initialize() {
        MeterRegistry registry = MetricsRegistry.getRegistry();
        if (registry == null) {
            log.warn("Cannot initialize SMTP metrics - registry is null");
            return;
        }

        counter(registry, SESSION_START, "Number of sessions started");
        counter(registry, SESSION_END, "Number of sessions terminated");
        counter(registry, MESSAGE_ACCEPTED, "Number of message bodies accepted");
        counter(registry, COMMAND_UNRECOGNIZED, "Number of unrecognized command lines");
        log.info("SMTP metrics initialized");
    }

    /**
     * Increment the session start counter.
     */
    public static void incrementSessionStart() {
        increment(SESSION_START, "Number of sessions started");
    }

    /**
     * Increment the session end counter.
     */
    public static void incrementSessionEnd() {
        increment(SESSION_END, "Number of sessions terminated");
    }

    /**
     * Increment the accepted message counter.
     */
    public static void incrementMessageAccepted() {
        increment(MESSAGE_ACCEPTED, "Number of message bodies accepted");
    }

    /**
     * Increment the unrecognized command counter.
     */
    public static void incrementUnrecognized() {
        increment(COMMAND_UNRECOGNIZED, "Number of unrecognized command lines");
    }

    /**
     * Increment the hook rejection counter.
     *
     * @param event Hook event name.
     */
    public static void incrementHookRejection(String event) {
        try {
            MeterRegistry registry = MetricsRegistry.getRegistry();
            if (registry != null) {
                Counter.builder(HOOK_REJECTION)
                        .description("Number of milestones rejected by hook handlers")
                        .tag("event", event)
                        .register(registry)
                        .increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment hook rejection counter: {}", e.getMessage());
        }
    }

    private static void increment(String name, String description) {
        try {
            MeterRegistry registry = MetricsRegistry.getRegistry();
            if (registry != null) {
                counter(registry, name, description).increment();
            }
        } catch (Exception e) {
            log.warn("Failed to increment {} counter: {}", name, e.getMessage());
        }
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(name)
                .description(description)
                .register(registry);
    }
}
