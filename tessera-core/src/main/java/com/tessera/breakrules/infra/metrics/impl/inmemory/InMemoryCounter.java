/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics.impl.inmemory;

import com.tessera.breakrules.infra.metrics.Counter;

import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link Counter} for testing.
 */
final class InMemoryCounter implements Counter {
    private final AtomicLong value = new AtomicLong();
    private final MetricKey key;

    InMemoryCounter(MetricKey key) {
        this.key = key;
    }

    @Override
    public void increment() {
        value.incrementAndGet();
    }

    long count() {
        return value.get();
    }

    @Override
    public String toString() {
        return String.format("InMemoryCounter{name='%s', count=%d}", key, count());
    }
}
