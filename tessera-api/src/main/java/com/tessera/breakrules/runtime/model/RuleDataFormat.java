/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.runtime.model;

import java.nio.ByteOrder;

/**
 * Constants describing the flattened rule data blob.
 *
 * <h2>Layout</h2>
 * <pre>
 * +----------------------+  0
 * | header (80 bytes)    |
 * +----------------------+  8-aligned
 * | forward state table  |
 * +----------------------+  8-aligned
 * | safe reverse table   |
 * +----------------------+  8-aligned
 * | category trie        |
 * +----------------------+  8-aligned
 * | rule status table    |
 * +----------------------+  8-aligned
 * | rule source (UTF-16) |
 * +----------------------+  total length
 * </pre>
 *
 * <p>All integers are little-endian. Padding between sections is zero.
 */
public final class RuleDataFormat {

    public static final int MAGIC = 0xB1A0;
    public static final int FORMAT_VERSION_MAJOR = 5;
    private static final byte[] FORMAT_VERSION = {FORMAT_VERSION_MAJOR, 0, 0, 0};
    public static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;
    public static final int ALIGNMENT = 8;

    // Header field offsets
    public static final int HEADER_SIZE = 80;
    public static final int OFFSET_MAGIC = 0;
    public static final int OFFSET_FORMAT_VERSION = 4;
    public static final int OFFSET_LENGTH = 8;
    public static final int OFFSET_CATEGORY_COUNT = 12;
    public static final int OFFSET_RESERVED = 56;

    // State tables
    public static final int STATE_TABLE_HEADER_SIZE = 16;
    public static final int ROW_HEADER_SIZE = 8;
    public static final int FLAG_LOOKAHEAD_HARD_BREAK = 1;
    public static final int FLAG_BOF_REQUIRED = 2;
    public static final int MAX_STATES = 0xFFFF;

    // Category trie
    public static final int TRIE_SIGNATURE = 0x43547269;
    public static final int TRIE_HEADER_SIZE = 32;
    public static final int TRIE_SHIFT_1 = 11;
    public static final int TRIE_SHIFT_2 = 5;
    public static final int TRIE_DATA_BLOCK_LENGTH = 1 << TRIE_SHIFT_2;
    public static final int TRIE_INDEX_2_BLOCK_LENGTH = 1 << (TRIE_SHIFT_1 - TRIE_SHIFT_2);
    public static final int TRIE_DATA_MASK = TRIE_DATA_BLOCK_LENGTH - 1;
    public static final int TRIE_INDEX_2_MASK = TRIE_INDEX_2_BLOCK_LENGTH - 1;
    public static final int TRIE_HIGH_START_GRANULARITY = 1 << TRIE_SHIFT_1;
    public static final int MAX_CODE_POINT = 0x10FFFF;

    private RuleDataFormat() {
        throw new AssertionError("No instances");
    }

    /**
     * Rounds {@code size} up to the next multiple of {@link #ALIGNMENT}.
     */
    public static long align8(long size) {
        return (size + (ALIGNMENT - 1)) & ~(long) (ALIGNMENT - 1);
    }

    public static int rowLength(int categoryCount) {
        return ROW_HEADER_SIZE + 2 * categoryCount;
    }

    public static long stateTableSize(int stateCount, int categoryCount) {
        return STATE_TABLE_HEADER_SIZE + (long) stateCount * rowLength(categoryCount);
    }

    /**
     * The four version bytes written to every header; a fresh copy per call.
     */
    public static byte[] formatVersion() {
        return FORMAT_VERSION.clone();
    }

    public static String formatVersionString() {
        return FORMAT_VERSION[0] + "." + FORMAT_VERSION[1] + "." + FORMAT_VERSION[2] + "." + FORMAT_VERSION[3];
    }
}
