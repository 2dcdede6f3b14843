/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics;

import java.time.Duration;

/**
 * Latency histogram fed with durations measured by the caller.
 * Thread-safe.
 */
@FunctionalInterface
public interface Timer {

    /**
     * Records a pre-measured duration.
     *
     * @throws IllegalArgumentException if {@code duration} is negative
     */
    void record(Duration duration);
}
