/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics;

/**
 * Last-value-wins measurement.
 * Thread-safe.
 */
@FunctionalInterface
public interface Gauge {
    void set(double value);
}
