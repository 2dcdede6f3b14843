/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics.impl.prometheus;

import com.tessera.breakrules.infra.metrics.Counter;

/**
 * Bridges {@link Counter} to a Prometheus counter child bound to fixed label values.
 *
 * <pre>{@code
 * io.prometheus.client.Counter failures = io.prometheus.client.Counter.build()
 *     .name("rules_compile_failures_total")
 *     .labelNames("code")
 *     .register();
 *
 * Counter unclosed = new PrometheusCounterAdapter(failures, new String[]{"UNCLOSED_SET"});
 * unclosed.increment();   // rules_compile_failures_total{code="UNCLOSED_SET"}
 * }</pre>
 */
final class PrometheusCounterAdapter implements Counter {

    private final io.prometheus.client.Counter.Child counter;

    /**
     * @param counter the Prometheus counter (parent, not yet bound to labels)
     * @param labelValues the values for each label, in label name order
     */
    PrometheusCounterAdapter(io.prometheus.client.Counter counter, String[] labelValues) {
        if (labelValues == null) {
            throw new IllegalArgumentException("Label values cannot be null");
        }
        this.counter = counter.labels(labelValues);
    }

    @Override
    public void increment() {
        counter.inc();
    }

    double count() {
        return counter.get();
    }

    @Override
    public String toString() {
        return String.format("PrometheusCounterAdapter{value=%.0f}", count());
    }
}
