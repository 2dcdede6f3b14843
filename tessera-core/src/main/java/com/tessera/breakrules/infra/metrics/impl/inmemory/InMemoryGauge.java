/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics.impl.inmemory;

import com.tessera.breakrules.infra.metrics.Gauge;

import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link Gauge} for testing.
 */
final class InMemoryGauge implements Gauge {

    private final MetricKey key;
    private final AtomicReference<Double> value = new AtomicReference<>(0.0);

    InMemoryGauge(MetricKey key) {
        this.key = key;
    }

    @Override
    public void set(double newValue) {
        value.set(newValue);
    }

    double value() {
        return value.get();
    }

    @Override
    public String toString() {
        return String.format("InMemoryGauge{name='%s', value=%.2f}", key, value());
    }
}
