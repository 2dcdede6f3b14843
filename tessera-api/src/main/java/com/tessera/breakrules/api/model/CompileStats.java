/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.api.model;

/**
 * Statistics gathered during one compilation.
 *
 * @param categoriesBeforeOptimization category count after range building
 * @param categoriesAfterOptimization category count after column merging
 * @param statesBeforeOptimization forward table state count as built
 * @param statesAfterOptimization forward table state count after row merging
 * @param optimizationPasses outer iterations of the minimization fixed point
 * @param safeTableStates row count of the safe reverse table
 * @param statusTagCount entries in the rule status table
 * @param dataLength total blob length in bytes
 * @param durationNanos wall time of the whole compilation
 */
public record CompileStats(
        int categoriesBeforeOptimization,
        int categoriesAfterOptimization,
        int statesBeforeOptimization,
        int statesAfterOptimization,
        int optimizationPasses,
        int safeTableStates,
        int statusTagCount,
        int dataLength,
        long durationNanos
) {
    public static final CompileStats EMPTY = new CompileStats(0, 0, 0, 0, 0, 0, 0, 0, 0L);

    public CompileStats withDuration(long nanos) {
        return new CompileStats(categoriesBeforeOptimization, categoriesAfterOptimization,
                statesBeforeOptimization, statesAfterOptimization, optimizationPasses,
                safeTableStates, statusTagCount, dataLength, nanos);
    }

    public double durationMillis() {
        return durationNanos / 1_000_000.0;
    }
}
