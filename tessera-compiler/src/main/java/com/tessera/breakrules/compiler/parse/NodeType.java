/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.parse;

/**
 * Parse tree node kinds.
 */
public enum NodeType {
    /** Reference to a set leaf; replaced by an OR of {@link #LEAF_CHAR} nodes before table building. */
    SET_REF(true),
    /** A single character category. */
    LEAF_CHAR(true),
    /** Reference to a variable; its left child is the definition root. */
    VAR_REF(false),
    /** The {@code /} look-ahead marker. */
    LOOK_AHEAD(true),
    /** A {@code {n}} rule status tag. */
    TAG(true),
    /** End of a rule (or of the whole tree). */
    END_MARK(true),
    CAT(false),
    OR(false),
    STAR(false),
    PLUS(false),
    QUESTION(false);

    private final boolean leaf;

    NodeType(boolean leaf) {
        this.leaf = leaf;
    }

    public boolean isLeaf() {
        return leaf;
    }

    /** Leaves that occupy a position in the followpos computation. */
    public boolean isPosition() {
        return this == LEAF_CHAR || this == LOOK_AHEAD || this == TAG || this == END_MARK;
    }
}
