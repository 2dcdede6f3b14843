/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics.impl.prometheus;

import com.tessera.breakrules.infra.metrics.Timer;

import java.time.Duration;

/**
 * Bridges {@link Timer} to a Prometheus histogram observed in seconds.
 *
 * <p>Quantiles come from {@code histogram_quantile()} over the exported buckets.
 */
final class PrometheusTimerAdapter implements Timer {

    private final io.prometheus.client.Histogram.Child histogram;

    PrometheusTimerAdapter(io.prometheus.client.Histogram histogram, String[] labelValues) {
        if (histogram == null) {
            throw new IllegalArgumentException("Histogram cannot be null");
        }
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public void record(Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("Duration cannot be null");
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Duration cannot be negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    /**
     * Number of observations so far.
     */
    long count() {
        return (long) histogram.get().buckets[histogram.get().buckets.length - 1];
    }

    double sum() {
        return histogram.get().sum;
    }
}
