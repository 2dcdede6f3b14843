/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.parse;

/**
 * A node in a parse tree. Children and definitions are {@link NodeArena} indices.
 */
public final class RuleNode {

    public static final int NONE = -1;

    private final NodeType type;
    private int left = NONE;
    private int right = NONE;
    private int val;
    private int setLeaf = NONE;
    private String name;
    private boolean ruleRoot;
    private boolean chainIn;
    private boolean lookAheadEnd;

    private RuleNode(NodeType type) {
        this.type = type;
    }

    public static RuleNode binary(NodeType type, int left, int right) {
        RuleNode node = new RuleNode(type);
        node.left = left;
        node.right = right;
        return node;
    }

    public static RuleNode unary(NodeType type, int child) {
        RuleNode node = new RuleNode(type);
        node.left = child;
        return node;
    }

    public static RuleNode setRef(int setLeaf) {
        RuleNode node = new RuleNode(NodeType.SET_REF);
        node.setLeaf = setLeaf;
        return node;
    }

    public static RuleNode varRef(String name, int definition) {
        RuleNode node = new RuleNode(NodeType.VAR_REF);
        node.name = name;
        node.left = definition;
        return node;
    }

    public static RuleNode leafChar(int category) {
        RuleNode node = new RuleNode(NodeType.LEAF_CHAR);
        node.val = category;
        return node;
    }

    public static RuleNode lookAhead(int ruleNumber) {
        RuleNode node = new RuleNode(NodeType.LOOK_AHEAD);
        node.val = ruleNumber;
        return node;
    }

    public static RuleNode tag(int value) {
        RuleNode node = new RuleNode(NodeType.TAG);
        node.val = value;
        return node;
    }

    public static RuleNode endMark(int ruleNumber, boolean lookAheadEnd) {
        RuleNode node = new RuleNode(NodeType.END_MARK);
        node.val = ruleNumber;
        node.lookAheadEnd = lookAheadEnd;
        return node;
    }

    /**
     * Copies this node's own fields; child indices are copied verbatim.
     */
    public RuleNode copy() {
        RuleNode node = new RuleNode(type);
        node.left = left;
        node.right = right;
        node.val = val;
        node.setLeaf = setLeaf;
        node.name = name;
        node.ruleRoot = ruleRoot;
        node.chainIn = chainIn;
        node.lookAheadEnd = lookAheadEnd;
        return node;
    }

    public NodeType type() {
        return type;
    }

    public int left() {
        return left;
    }

    public int right() {
        return right;
    }

    public void setChildren(int left, int right) {
        this.left = left;
        this.right = right;
    }

    public int val() {
        return val;
    }

    public int setLeaf() {
        return setLeaf;
    }

    public String name() {
        return name;
    }

    public boolean isRuleRoot() {
        return ruleRoot;
    }

    public void markRuleRoot(boolean chainIn) {
        this.ruleRoot = true;
        this.chainIn = chainIn;
    }

    /**
     * Takes over the rule-root flags of a node this one replaces.
     */
    public void inheritRootFlags(RuleNode replaced) {
        if (replaced.ruleRoot) {
            this.ruleRoot = true;
            this.chainIn = replaced.chainIn;
        }
    }

    public boolean isChainIn() {
        return chainIn;
    }

    public boolean isLookAheadEnd() {
        return lookAheadEnd;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name());
        switch (type) {
            case LEAF_CHAR, LOOK_AHEAD, TAG, END_MARK -> sb.append('(').append(val).append(')');
            case SET_REF -> sb.append("(leaf ").append(setLeaf).append(')');
            case VAR_REF -> sb.append('(').append(name).append(')');
            default -> {
            }
        }
        if (ruleRoot) {
            sb.append(chainIn ? " root,chain-in" : " root");
        }
        return sb.toString();
    }
}
