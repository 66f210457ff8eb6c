package com.mimecast.wren.metrics;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Global access to the metric registry.
 *
 * <p>Metrics are not recorded until a registry is registered.
 */
public final class MetricsRegistry {
    private static volatile MeterRegistry registry;

    /**
     * Private constructor for utility class.
     */
    private MetricsRegistry() {
    }

    /**
     * Register the metric registry.
     *
     * @param meterRegistry Registry or null to stop recording.
     */
    public static void register(MeterRegistry meterRegistry) {
        registry = meterRegistry;
    }

    /**
     * Get the registry.
     *
     * @return MeterRegistry or null.
     */
    public static MeterRegistry getRegistry() {
        return registry;
    }
}
