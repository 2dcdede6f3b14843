/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics.api;

import com.tessera.breakrules.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>Have a public no-arg constructor
 *   <li>Be thread-safe
 *   <li>Register themselves in {@code META-INF/services}
 * </ul>
 */
public interface MetricsRegistryProvider {

    /**
     * Creates a new MetricsRegistry instance.
     *
     * @return registry instance (must be thread-safe)
     */
    MetricsRegistry create();

    /**
     * Higher values are preferred when multiple providers exist.
     */
    default int priority() {
        return 0;
    }

    /**
     * Provider name for logging.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
