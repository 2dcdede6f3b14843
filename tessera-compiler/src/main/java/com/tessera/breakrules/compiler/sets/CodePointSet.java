/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.sets;

import com.ibm.icu.text.UnicodeSet;
import com.tessera.breakrules.runtime.model.RuleDataFormat;

/**
 * Immutable set of code points held by a set leaf.
 *
 * <p>Backed by a frozen {@link UnicodeSet} with its strings removed, so
 * {@code {bof}} and {@code {eof}} never appear here; the leaf records them
 * separately.
 */
public final class CodePointSet {

    private static final CodePointSet EMPTY = new CodePointSet(new UnicodeSet().freeze());
    private static final CodePointSet ALL =
            new CodePointSet(new UnicodeSet(0, RuleDataFormat.MAX_CODE_POINT).freeze());

    private final UnicodeSet set;

    private CodePointSet(UnicodeSet frozen) {
        this.set = frozen;
    }

    public static CodePointSet empty() {
        return EMPTY;
    }

    public static CodePointSet all() {
        return ALL;
    }

    public static CodePointSet of(int codePoint) {
        return range(codePoint, codePoint);
    }

    public static CodePointSet range(int start, int end) {
        if (start < 0 || end > RuleDataFormat.MAX_CODE_POINT || start > end) {
            throw new IllegalArgumentException(String.format("Invalid range U+%04X..U+%04X", start, end));
        }
        return new CodePointSet(new UnicodeSet(start, end).freeze());
    }

    /**
     * Copies the code points of {@code source}; its strings are dropped.
     */
    public static CodePointSet from(UnicodeSet source) {
        UnicodeSet copy = source.cloneAsThawed().removeAllStrings();
        return copy.isEmpty() ? EMPTY : new CodePointSet(copy.freeze());
    }

    /**
     * A thawed copy for further set algebra.
     */
    public UnicodeSet toUnicodeSet() {
        return set.cloneAsThawed();
    }

    public boolean contains(int codePoint) {
        return set.contains(codePoint);
    }

    public boolean isEmpty() {
        return set.isEmpty();
    }

    public int rangeCount() {
        return set.getRangeCount();
    }

    public int rangeStart(int index) {
        return set.getRangeStart(index);
    }

    /** Inclusive end of the range at {@code index}. */
    public int rangeEnd(int index) {
        return set.getRangeEnd(index);
    }

    public long size() {
        return set.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodePointSet that)) return false;
        return set.equals(that.set);
    }

    @Override
    public int hashCode() {
        return set.hashCode();
    }

    @Override
    public String toString() {
        return set.toPattern(true);
    }
}
