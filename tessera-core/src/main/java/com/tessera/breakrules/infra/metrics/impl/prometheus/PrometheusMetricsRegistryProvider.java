/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics.impl.prometheus;

import com.tessera.breakrules.infra.metrics.MetricsRegistry;
import com.tessera.breakrules.infra.metrics.api.MetricsRegistryProvider;

/**
 * Prometheus-backed metrics provider, registered in
 * {@code META-INF/services/com.tessera.breakrules.infra.metrics.api.MetricsRegistryProvider}.
 */
public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
