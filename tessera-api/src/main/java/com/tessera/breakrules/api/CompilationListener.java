/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.api;

import java.util.Map;

/**
 * Callback interface for compilation stage events.
 *
 * <p>The compilation pipeline consists of 7 stages:
 * <ol>
 *   <li>PARSING - Scan rule text into parse trees</li>
 *   <li>CATEGORY_BUILDING - Partition code points into character categories</li>
 *   <li>FORWARD_TABLE - Build the forward state table</li>
 *   <li>TABLE_OPTIMIZATION - Merge duplicate categories and states</li>
 *   <li>SAFE_REVERSE_TABLE - Build the safe reverse table</li>
 *   <li>TRIE_BUILDING - Build the code point to category trie</li>
 *   <li>FLATTENING - Write all sections into one aligned blob</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * CompilationListener listener = new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageStart(String stageName, int stageNumber, int totalStages) {
 *         System.out.printf("Starting %s (%d/%d)%n", stageName, stageNumber, totalStages);
 *     }
 *
 *     {@literal @}Override
 *     public void onStageComplete(String stageName, StageResult result) {
 *         System.out.printf("Completed %s in %d us%n", stageName, result.durationMicros());
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String stageName, Exception error) {
 *         System.err.printf("Error in %s: %s%n", stageName, error.getMessage());
 *     }
 * };
 *
 * IRuleCompiler compiler = new RuleCompiler();
 * compiler.setCompilationListener(listener);
 * CompileResult result = compiler.compile(rules);
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called when a compilation stage starts.
     *
     * @param stageName Name of the stage (e.g., "PARSING", "FORWARD_TABLE")
     * @param stageNumber Current stage number (1-based)
     * @param totalStages Total number of stages
     */
    void onStageStart(String stageName, int stageNumber, int totalStages);

    /**
     * Called when a compilation stage completes successfully.
     *
     * @param stageName Name of the stage
     * @param result Result containing duration and stage-specific metrics
     */
    void onStageComplete(String stageName, StageResult result);

    /**
     * Called when a compilation stage fails.
     *
     * @param stageName Name of the stage that failed
     * @param error The exception that occurred
     */
    void onError(String stageName, Exception error);

    /**
     * Result of a single compilation stage.
     *
     * @param stageName Name of the stage
     * @param durationNanos Duration in nanoseconds
     * @param metrics Stage-specific metrics (e.g., "categoryCount", "stateCount")
     */
    record StageResult(
        String stageName,
        long durationNanos,
        Map<String, Object> metrics
    ) {
        /**
         * Returns the duration in milliseconds.
         */
        public long durationMillis() {
            return durationNanos / 1_000_000;
        }

        /**
         * Returns the duration in microseconds.
         */
        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
