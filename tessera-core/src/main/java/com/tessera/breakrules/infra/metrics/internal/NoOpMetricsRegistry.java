/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics.internal;

import com.tessera.breakrules.infra.metrics.Counter;
import com.tessera.breakrules.infra.metrics.Gauge;
import com.tessera.breakrules.infra.metrics.MetricsRegistry;
import com.tessera.breakrules.infra.metrics.Timer;

/**
 * Fallback used when no provider is configured. Every series is the same
 * discarding instance.
 */
enum NoOpMetricsRegistry implements MetricsRegistry {
    INSTANCE;

    private static final Counter DISCARD_COUNT = () -> { };
    private static final Gauge DISCARD_VALUE = value -> { };
    private static final Timer DISCARD_DURATION = duration -> { };

    @Override
    public Counter counter(String name, String... tags) {
        return DISCARD_COUNT;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return DISCARD_VALUE;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return DISCARD_DURATION;
    }
}
