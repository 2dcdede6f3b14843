/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.sets;

import com.tessera.breakrules.runtime.model.RuleDataFormat;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;

import static com.tessera.breakrules.runtime.model.RuleDataFormat.TRIE_DATA_BLOCK_LENGTH;
import static com.tessera.breakrules.runtime.model.RuleDataFormat.TRIE_DATA_MASK;
import static com.tessera.breakrules.runtime.model.RuleDataFormat.TRIE_HIGH_START_GRANULARITY;
import static com.tessera.breakrules.runtime.model.RuleDataFormat.TRIE_INDEX_2_BLOCK_LENGTH;
import static com.tessera.breakrules.runtime.model.RuleDataFormat.TRIE_INDEX_2_MASK;
import static com.tessera.breakrules.runtime.model.RuleDataFormat.TRIE_SHIFT_1;
import static com.tessera.breakrules.runtime.model.RuleDataFormat.TRIE_SHIFT_2;

/**
 * Builds the two-stage code point to category trie.
 *
 * <p>Code points below {@code highStart} are looked up through index-1
 * (one entry per 2048 code points, holding an index-2 offset) and index-2
 * (one entry per 32 code points, holding a data block number). Identical
 * data blocks and identical index-2 blocks are stored once. Code points at or
 * above {@code highStart} all map to {@code highValue}.
 */
public final class TrieBuilder {

    private static final int ERROR_VALUE = 0;

    private TrieBuilder() {
        throw new AssertionError("No instances");
    }

    /**
     * Builds a trie from ranges that cover every code point exactly once, in order.
     */
    public static CategoryTrie build(List<CategoryRange> ranges) {
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("Ranges must cover the code space");
        }
        int[] values = expand(ranges);
        int highValue = values[RuleDataFormat.MAX_CODE_POINT];
        int highStart = computeHighStart(values, highValue);

        IntArrayList data = new IntArrayList();
        IntArrayList index2 = new IntArrayList();
        int[] index1 = new int[highStart >> TRIE_SHIFT_1];

        Object2IntOpenHashMap<IntArrayList> dataBlocks = new Object2IntOpenHashMap<>();
        dataBlocks.defaultReturnValue(-1);
        Object2IntOpenHashMap<IntArrayList> index2Blocks = new Object2IntOpenHashMap<>();
        index2Blocks.defaultReturnValue(-1);

        for (int i1 = 0; i1 < index1.length; i1++) {
            IntArrayList index2Block = new IntArrayList(TRIE_INDEX_2_BLOCK_LENGTH);
            for (int i2 = 0; i2 < TRIE_INDEX_2_BLOCK_LENGTH; i2++) {
                int blockStart = (i1 << TRIE_SHIFT_1) + (i2 << TRIE_SHIFT_2);
                IntArrayList block = new IntArrayList(values, blockStart, TRIE_DATA_BLOCK_LENGTH);
                int blockNumber = dataBlocks.getInt(block);
                if (blockNumber < 0) {
                    blockNumber = data.size() >> TRIE_SHIFT_2;
                    dataBlocks.put(block, blockNumber);
                    data.addAll(block);
                }
                index2Block.add(blockNumber);
            }
            int offset = index2Blocks.getInt(index2Block);
            if (offset < 0) {
                offset = index2.size();
                index2Blocks.put(index2Block, offset);
                index2.addAll(index2Block);
            }
            index1[i1] = offset;
        }

        checkUnsigned16("index-2 offset", index2.size());
        checkUnsigned16("data block count", data.size() >> TRIE_SHIFT_2);
        return new CategoryTrie(index1, index2.toIntArray(), data.toIntArray(), highStart, highValue, ERROR_VALUE);
    }

    private static int[] expand(List<CategoryRange> ranges) {
        int[] values = new int[RuleDataFormat.MAX_CODE_POINT + 1];
        int expected = 0;
        for (CategoryRange range : ranges) {
            if (range.start() != expected || range.end() < range.start()) {
                throw new IllegalArgumentException("Ranges must be contiguous, gap at U+"
                        + Integer.toHexString(expected));
            }
            checkUnsigned16("category", range.category());
            Arrays.fill(values, range.start(), range.end() + 1, range.category());
            expected = range.end() + 1;
        }
        if (expected != RuleDataFormat.MAX_CODE_POINT + 1) {
            throw new IllegalArgumentException("Ranges end at U+" + Integer.toHexString(expected - 1));
        }
        return values;
    }

    private static int computeHighStart(int[] values, int highValue) {
        int last = RuleDataFormat.MAX_CODE_POINT;
        while (last >= 0 && values[last] == highValue) {
            last--;
        }
        int highStart = last + 1;
        return (highStart + TRIE_HIGH_START_GRANULARITY - 1) & ~(TRIE_HIGH_START_GRANULARITY - 1);
    }

    private static void checkUnsigned16(String what, int value) {
        if (value < 0 || value > 0xFFFF) {
            throw new IllegalStateException(what + " does not fit in 16 bits: " + value);
        }
    }

    /**
     * A finished trie. Its arrays stay private; they leave only through
     * {@link #writeTo(ByteBuffer)}.
     */
    public static final class CategoryTrie {

        private final int[] index1;
        private final int[] index2;
        private final int[] data;
        private final int highStart;
        private final int highValue;
        private final int errorValue;

        CategoryTrie(int[] index1, int[] index2, int[] data, int highStart, int highValue, int errorValue) {
            this.index1 = index1;
            this.index2 = index2;
            this.data = data;
            this.highStart = highStart;
            this.highValue = highValue;
            this.errorValue = errorValue;
        }

        public int index1Length() {
            return index1.length;
        }

        public int index2Length() {
            return index2.length;
        }

        public int dataLength() {
            return data.length;
        }

        public int highStart() {
            return highStart;
        }

        public int highValue() {
            return highValue;
        }

        public int errorValue() {
            return errorValue;
        }

        public int get(int codePoint) {
            if (codePoint < 0 || codePoint > RuleDataFormat.MAX_CODE_POINT) {
                return errorValue;
            }
            if (codePoint >= highStart) {
                return highValue;
            }
            int block = index2[index1[codePoint >> TRIE_SHIFT_1] + ((codePoint >> TRIE_SHIFT_2) & TRIE_INDEX_2_MASK)];
            return data[(block << TRIE_SHIFT_2) + (codePoint & TRIE_DATA_MASK)];
        }

        public int serializedSize() {
            return RuleDataFormat.TRIE_HEADER_SIZE + 2 * (index1.length + index2.length + data.length);
        }

        /**
         * Writes the trie at the buffer's position using relative puts.
         */
        public void writeTo(ByteBuffer out) {
            out.putInt(RuleDataFormat.TRIE_SIGNATURE);
            out.putInt(index1.length);
            out.putInt(index2.length);
            out.putInt(data.length);
            out.putInt(highStart);
            out.putInt(highValue);
            out.putInt(errorValue);
            out.putInt(0);
            for (int v : index1) {
                out.putShort((short) v);
            }
            for (int v : index2) {
                out.putShort((short) v);
            }
            for (int v : data) {
                out.putShort((short) v);
            }
        }
    }
}
