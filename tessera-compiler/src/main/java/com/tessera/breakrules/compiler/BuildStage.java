/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler;

/**
 * Pipeline stages of {@link RuleBuilder}, in execution order.
 */
public enum BuildStage {
    PARSING("parse-rules"),
    CATEGORY_BUILDING("build-categories"),
    FORWARD_TABLE("build-forward-table"),
    TABLE_OPTIMIZATION("optimize-tables"),
    SAFE_REVERSE_TABLE("build-safe-reverse-table"),
    TRIE_BUILDING("build-trie"),
    FLATTENING("flatten-data");

    private final String spanName;

    BuildStage(String spanName) {
        this.spanName = spanName;
    }

    public String spanName() {
        return spanName;
    }

    /** 1-based position in the pipeline. */
    public int number() {
        return ordinal() + 1;
    }
}
