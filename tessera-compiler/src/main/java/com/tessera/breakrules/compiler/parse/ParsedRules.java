/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.parse;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link RuleScanner#parse()}.
 */
public final class ParsedRules {

    private final NodeArena arena;
    private final Map<RuleTree, Integer> roots;
    private final RuleTree defaultTree;
    private final List<SetLeaf> setLeaves;
    private final IntList statusValues;
    private final RuleOptions options;
    private final int ruleCount;
    private final int variableCount;

    ParsedRules(NodeArena arena, Map<RuleTree, Integer> roots, RuleTree defaultTree, List<SetLeaf> setLeaves,
                IntList statusValues, RuleOptions options, int ruleCount, int variableCount) {
        this.arena = arena;
        this.roots = Collections.unmodifiableMap(new EnumMap<>(roots));
        this.defaultTree = defaultTree;
        this.setLeaves = Collections.unmodifiableList(setLeaves);
        this.statusValues = IntLists.unmodifiable(statusValues);
        this.options = options;
        this.ruleCount = ruleCount;
        this.variableCount = variableCount;
    }

    public NodeArena arena() {
        return arena;
    }

    /**
     * Root node index of {@code tree}, or {@link RuleNode#NONE} if the rules never populated it.
     */
    public int root(RuleTree tree) {
        return roots.getOrDefault(tree, RuleNode.NONE);
    }

    /** Tree selected by the last direction option; rules without {@code !} went there. */
    public RuleTree defaultTree() {
        return defaultTree;
    }

    public List<SetLeaf> setLeaves() {
        return setLeaves;
    }

    /** Distinct status tag values; entry 0 is always 0. */
    public IntList statusValues() {
        return statusValues;
    }

    public RuleOptions options() {
        return options;
    }

    public int ruleCount() {
        return ruleCount;
    }

    public int variableCount() {
        return variableCount;
    }
}
