/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.parse;

import com.tessera.breakrules.compiler.sets.CodePointSet;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * A distinct set expression from the rules, identified by its source text.
 *
 * <p>After category building, {@link #categories()} lists the categories the
 * set covers, in allocation order.
 */
public final class SetLeaf {

    private final int index;
    private final String sourceText;
    private final CodePointSet codePoints;
    private final boolean beginOfText;
    private final boolean endOfText;
    private final IntArrayList categories = new IntArrayList();

    public SetLeaf(int index, String sourceText, CodePointSet codePoints, boolean beginOfText, boolean endOfText) {
        this.index = index;
        this.sourceText = sourceText;
        this.codePoints = codePoints;
        this.beginOfText = beginOfText;
        this.endOfText = endOfText;
    }

    public int index() {
        return index;
    }

    public String sourceText() {
        return sourceText;
    }

    public CodePointSet codePoints() {
        return codePoints;
    }

    public boolean containsBeginOfText() {
        return beginOfText;
    }

    public boolean containsEndOfText() {
        return endOfText;
    }

    public void addCategory(int category) {
        if (!categories.contains(category)) {
            categories.add(category);
        }
    }

    public IntList categories() {
        return IntLists.unmodifiable(categories);
    }

    @Override
    public String toString() {
        return "SetLeaf{" + index + " " + sourceText + " -> " + categories + "}";
    }
}
