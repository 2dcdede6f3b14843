/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.infra.metrics.impl.inmemory;

import java.util.List;

/**
 * Name plus label pairs identifying one in-memory series.
 */
record MetricKey(String name, List<String> tags) {

    static MetricKey of(String name, String... tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key-value pairs: " + List.of(tags));
        }
        return new MetricKey(name, List.of(tags));
    }

    @Override
    public String toString() {
        return tags.isEmpty() ? name : name + tags;
    }
}
