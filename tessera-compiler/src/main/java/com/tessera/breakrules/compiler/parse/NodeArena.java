/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns every node of one or more parse trees. Nodes refer to each other by index.
 */
public final class NodeArena {

    private final List<RuleNode> nodes = new ArrayList<>();

    public int add(RuleNode node) {
        nodes.add(node);
        return nodes.size() - 1;
    }

    public RuleNode get(int index) {
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Renders the tree under {@code root}, one node per line, children indented.
     */
    public String describe(int root) {
        StringBuilder sb = new StringBuilder();
        describe(root, 0, sb);
        return sb.toString();
    }

    private void describe(int index, int depth, StringBuilder sb) {
        if (index == RuleNode.NONE) {
            return;
        }
        RuleNode node = nodes.get(index);
        sb.append("  ".repeat(depth)).append(index).append(": ").append(node).append('\n');
        if (node.type() == NodeType.VAR_REF) {
            // Definitions are shared; print the reference only.
            return;
        }
        describe(node.left(), depth + 1, sb);
        describe(node.right(), depth + 1, sb);
    }
}
