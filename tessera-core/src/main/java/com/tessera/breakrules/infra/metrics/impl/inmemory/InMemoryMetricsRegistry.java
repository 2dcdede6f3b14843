/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics.impl.inmemory;

import com.tessera.breakrules.infra.metrics.Counter;
import com.tessera.breakrules.infra.metrics.Gauge;
import com.tessera.breakrules.infra.metrics.MetricsRegistry;
import com.tessera.breakrules.infra.metrics.Timer;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory metrics registry for testing.
 *
 * <p>Provides access to recorded values for assertions:
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = (InMemoryMetricsRegistry) MetricsRegistry.getInstance();
 * assertThat(metrics.getCounterValue("rules_compile_failures_total", "code", "UNCLOSED_SET")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<MetricKey, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<MetricKey, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<MetricKey, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(MetricKey.of(name, tags), InMemoryCounter::new);
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(MetricKey.of(name, tags), InMemoryGauge::new);
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(MetricKey.of(name, tags), InMemoryTimer::new);
    }

    // Test helper methods

    public long getCounterValue(String name, String... tags) {
        InMemoryCounter counter = counters.get(MetricKey.of(name, tags));
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name, String... tags) {
        InMemoryGauge gauge = gauges.get(MetricKey.of(name, tags));
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(MetricKey.of(name, tags));
        return timer != null ? timer.recordings() : Collections.emptyList();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }
}
