/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics.impl.inmemory;

import com.tessera.breakrules.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link Timer} for testing.
 * Keeps every recorded duration in arrival order.
 */
final class InMemoryTimer implements Timer {

    private final MetricKey key;
    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    InMemoryTimer(MetricKey key) {
        this.key = key;
    }

    @Override
    public void record(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration: " + duration);
        }
        recordings.add(duration);
    }

    List<Duration> recordings() {
        return List.copyOf(recordings);
    }

    @Override
    public String toString() {
        return String.format("InMemoryTimer{name='%s', count=%d}", key, recordings.size());
    }
}
