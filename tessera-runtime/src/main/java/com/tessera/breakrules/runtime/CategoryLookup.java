/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.runtime;

import com.tessera.breakrules.api.exceptions.InvalidRuleDataException;
import com.tessera.breakrules.runtime.model.RuleDataFormat;

import java.nio.ByteBuffer;

import static com.tessera.breakrules.runtime.model.RuleDataFormat.TRIE_DATA_BLOCK_LENGTH;
import static com.tessera.breakrules.runtime.model.RuleDataFormat.TRIE_DATA_MASK;
import static com.tessera.breakrules.runtime.model.RuleDataFormat.TRIE_INDEX_2_BLOCK_LENGTH;
import static com.tessera.breakrules.runtime.model.RuleDataFormat.TRIE_INDEX_2_MASK;
import static com.tessera.breakrules.runtime.model.RuleDataFormat.TRIE_SHIFT_1;
import static com.tessera.breakrules.runtime.model.RuleDataFormat.TRIE_SHIFT_2;

/**
 * Code point to character category lookup over a serialized trie section.
 */
public final class CategoryLookup {

    private final char[] index1;
    private final char[] index2;
    private final char[] data;
    private final int highStart;
    private final int highValue;
    private final int errorValue;

    CategoryLookup(ByteBuffer section, int categoryCount) {
        ByteBuffer in = section.order(RuleDataFormat.BYTE_ORDER);
        if (in.limit() < RuleDataFormat.TRIE_HEADER_SIZE) {
            throw new InvalidRuleDataException("Trie is shorter than its header: " + in.limit());
        }
        int signature = in.getInt(0);
        if (signature != RuleDataFormat.TRIE_SIGNATURE) {
            throw new InvalidRuleDataException(String.format("Bad trie signature 0x%08X", signature));
        }
        int index1Length = in.getInt(4);
        int index2Length = in.getInt(8);
        int dataLength = in.getInt(12);
        this.highStart = in.getInt(16);
        this.highValue = in.getInt(20);
        this.errorValue = in.getInt(24);

        long expected = RuleDataFormat.TRIE_HEADER_SIZE + 2L * ((long) index1Length + index2Length + dataLength);
        if (index1Length < 0 || index2Length < 0 || dataLength < 0 || expected != in.limit()) {
            throw new InvalidRuleDataException(String.format(
                    "Trie arrays (%d, %d, %d) do not fill its %d bytes",
                    index1Length, index2Length, dataLength, in.limit()));
        }
        if ((long) index1Length << TRIE_SHIFT_1 != highStart || highStart > RuleDataFormat.MAX_CODE_POINT + 1) {
            throw new InvalidRuleDataException("Trie highStart 0x" + Integer.toHexString(highStart)
                    + " does not match " + index1Length + " index-1 entries");
        }
        if (highValue < 0 || highValue >= categoryCount || errorValue < 0 || errorValue >= categoryCount) {
            throw new InvalidRuleDataException("Trie default values out of category range");
        }

        ByteBuffer arrays = in.duplicate().order(RuleDataFormat.BYTE_ORDER).position(RuleDataFormat.TRIE_HEADER_SIZE);
        this.index1 = readChars(arrays, index1Length);
        this.index2 = readChars(arrays, index2Length);
        this.data = readChars(arrays, dataLength);

        for (char offset : index1) {
            if (offset + TRIE_INDEX_2_BLOCK_LENGTH > index2.length) {
                throw new InvalidRuleDataException("Trie index-1 entry out of range: " + (int) offset);
            }
        }
        for (char block : index2) {
            if ((block << TRIE_SHIFT_2) + TRIE_DATA_BLOCK_LENGTH > data.length) {
                throw new InvalidRuleDataException("Trie index-2 entry out of range: " + (int) block);
            }
        }
        for (char category : data) {
            if (category >= categoryCount) {
                throw new InvalidRuleDataException("Trie maps to missing category " + (int) category);
            }
        }
    }

    private static char[] readChars(ByteBuffer in, int count) {
        char[] values = new char[count];
        for (int i = 0; i < count; i++) {
            values[i] = in.getChar();
        }
        return values;
    }

    /**
     * Category of {@code codePoint}; the trie's error value for anything outside the code space.
     */
    public int categoryOf(int codePoint) {
        if (codePoint < 0 || codePoint > RuleDataFormat.MAX_CODE_POINT) {
            return errorValue;
        }
        if (codePoint >= highStart) {
            return highValue;
        }
        int block = index2[index1[codePoint >> TRIE_SHIFT_1] + ((codePoint >> TRIE_SHIFT_2) & TRIE_INDEX_2_MASK)];
        return data[(block << TRIE_SHIFT_2) + (codePoint & TRIE_DATA_MASK)];
    }

    public int highStart() {
        return highStart;
    }

    public int highValue() {
        return highValue;
    }
}
