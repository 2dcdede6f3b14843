/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics;

/**
 * Monotonically increasing counter.
 * Thread-safe.
 */
@FunctionalInterface
public interface Counter {
    void increment();
}
