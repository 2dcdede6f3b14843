/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics;

import com.tessera.breakrules.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; see
 * {@link com.tessera.breakrules.infra.metrics.api.MetricsRegistryProvider}.
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * metrics.counter("rules_compile_failures_total", "code", "UNCLOSED_SET").increment();
 * }</pre>
 *
 * <p>Tags are alternating label names and values. A metric name must always be
 * used with the same label names; each distinct set of values is a separate series.
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags optional key-value pairs for labels
     * @return thread-safe counter instance
     */
    Counter counter(String name, String... tags);

    /**
     * Creates or retrieves a gauge.
     */
    Gauge gauge(String name, String... tags);

    /**
     * Creates or retrieves a timer.
     */
    Timer timer(String name, String... tags);

    /**
     * Gets the process-wide registry, chosen once from the highest-priority
     * provider on the class path; falls back to a no-op registry.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
