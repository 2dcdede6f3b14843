/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics.impl.inmemory;

import com.tessera.breakrules.infra.metrics.MetricsRegistry;
import com.tessera.breakrules.infra.metrics.api.MetricsRegistryProvider;

/**
 * In-memory metrics provider for testing.
 *
 * <p>To enable in tests, list this class in
 * {@code src/test/resources/META-INF/services/com.tessera.breakrules.infra.metrics.api.MetricsRegistryProvider}.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 1000;
    }

    @Override
    public String name() {
        return "InMemory (Test)";
    }
}
