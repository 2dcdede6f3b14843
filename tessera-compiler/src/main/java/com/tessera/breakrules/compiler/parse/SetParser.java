/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.parse;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.text.SymbolTable;
import com.ibm.icu.text.UnicodeMatcher;
import com.ibm.icu.text.UnicodeSet;
import com.tessera.breakrules.api.model.RuleErrorCode;
import com.tessera.breakrules.compiler.sets.CodePointSet;

import java.text.ParsePosition;

/**
 * Parses set expressions for {@link RuleScanner}, sharing its position.
 *
 * <p>The expression itself is handed to {@link UnicodeSet}, which covers
 * ranges, nested sets, {@code &} and {@code -}, {@code \p{...}} and
 * {@code [:...:]} over the full Unicode property database. White space inside
 * a set is ignored. {@code $name} references are resolved through this
 * parser acting as the {@link SymbolTable}; a variable stands for the set it
 * was defined as. The only strings allowed are {@code {bof}} and {@code {eof}}.
 */
final class SetParser implements SymbolTable {

    record SetValue(CodePointSet codePoints, boolean beginOfText, boolean endOfText) {
    }

    static final String BEGIN_OF_TEXT = "bof";
    static final String END_OF_TEXT = "eof";

    // Stands in for a variable's set in the replacement text; a noncharacter.
    private static final char SET_REFERENCE = (char) 0xFFFF;

    private final RuleScanner scanner;
    private UnicodeSet cachedLookup;
    private int referenceStart;

    SetParser(RuleScanner scanner) {
        this.scanner = scanner;
    }

    /**
     * Parses a bracketed set; the scanner is positioned at its {@code [}.
     */
    SetValue parseSet() {
        int open = scanner.pos;
        if (findClose(open) < 0) {
            throw scanner.syntaxError(RuleErrorCode.UNCLOSED_SET, "Missing ']'", open);
        }
        return parse(open);
    }

    /**
     * Parses {@code \p{...}} or {@code \P{...}}; the scanner is positioned at
     * the backslash.
     */
    SetValue parsePropertyEscape() {
        return parse(scanner.pos);
    }

    private SetValue parse(int start) {
        ParsePosition position = new ParsePosition(scanner.charIndex(start));
        UnicodeSet set;
        try {
            set = new UnicodeSet(scanner.rules(), position, this, UnicodeSet.IGNORE_SPACE);
        } catch (IllegalArgumentException e) {
            throw scanner.syntaxError(RuleErrorCode.MALFORMED_SET, e.getMessage(), start);
        } finally {
            cachedLookup = null;
        }
        scanner.pos = scanner.codePointIndex(position.getIndex());

        for (String string : set.strings()) {
            if (!string.equals(BEGIN_OF_TEXT) && !string.equals(END_OF_TEXT)) {
                throw scanner.syntaxError(RuleErrorCode.MALFORMED_SET,
                        "Only {bof} and {eof} strings are allowed in sets", start);
            }
        }
        return new SetValue(CodePointSet.from(set), set.contains(BEGIN_OF_TEXT), set.contains(END_OF_TEXT));
    }

    /**
     * Code point index of the {@code ]} closing the set opened at {@code open},
     * or -1 if the rules end first.
     */
    private int findClose(int open) {
        int depth = 0;
        for (int i = open; i < scanner.length(); i++) {
            int c = scanner.at(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                while (i + 1 < scanner.length() && scanner.at(i + 1) != '}') {
                    i++;
                }
            } else if (c == '[') {
                depth++;
            } else if (c == ']' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public char[] lookup(String name) {
        SetLeaf leaf = scanner.setVariable(SYMBOL_REF + name, referenceStart);
        UnicodeSet value = leaf.codePoints().toUnicodeSet();
        if (leaf.containsBeginOfText()) {
            value.add(BEGIN_OF_TEXT);
        }
        if (leaf.containsEndOfText()) {
            value.add(END_OF_TEXT);
        }
        cachedLookup = value;
        return new char[]{SET_REFERENCE};
    }

    @Override
    public UnicodeMatcher lookupMatcher(int ch) {
        return ch == SET_REFERENCE ? cachedLookup : null;
    }

    @Override
    public String parseReference(String text, ParsePosition pos, int limit) {
        int start = pos.getIndex();
        referenceStart = scanner.codePointIndex(start - 1);
        int i = start;
        while (i < limit) {
            int c = text.codePointAt(i);
            boolean valid = i == start
                    ? UCharacter.isUnicodeIdentifierStart(c)
                    : UCharacter.isUnicodeIdentifierPart(c);
            if (!valid) {
                break;
            }
            i += Character.charCount(c);
        }
        if (i == start) {
            return null;
        }
        pos.setIndex(i);
        return text.substring(start, i);
    }
}
