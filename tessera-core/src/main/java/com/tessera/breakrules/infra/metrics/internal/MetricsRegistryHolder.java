/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics.internal;

import com.tessera.breakrules.infra.metrics.MetricsRegistry;
import com.tessera.breakrules.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.StreamSupport;

/**
 * Lazy holder for the singleton MetricsRegistry.
 *
 * <p><b>INTERNAL USE ONLY</b> - API may change without notice.
 */
public final class MetricsRegistryHolder {

    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry INSTANCE = select(ServiceLoader.load(MetricsRegistryProvider.class));

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    static MetricsRegistry select(Iterable<MetricsRegistryProvider> providers) {
        MetricsRegistryProvider provider = StreamSupport.stream(providers.spliterator(), false)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority))
                .orElse(null);

        if (provider == null) {
            logger.info("No metrics provider found, using no-op implementation");
            return NoOpMetricsRegistry.INSTANCE;
        }
        logger.info(String.format("Using metrics provider: %s (priority: %d)", provider.name(), provider.priority()));
        return provider.create();
    }
}
