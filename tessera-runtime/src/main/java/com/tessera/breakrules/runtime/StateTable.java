/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.runtime;

import com.tessera.breakrules.api.exceptions.InvalidRuleDataException;
import com.tessera.breakrules.runtime.model.RuleDataFormat;

import java.nio.ByteBuffer;

/**
 * Read-only view of a state table section.
 *
 * <p>Row {@code s} holds the {@code accepting}, {@code lookAhead} and
 * {@code tagIndex} values of state {@code s} followed by one next-state entry
 * per character category. State 0 is the stop state, state 1 the start state.
 */
public final class StateTable {

    private static final int ROW_OFFSET_ACCEPTING = 0;
    private static final int ROW_OFFSET_LOOKAHEAD = 2;
    private static final int ROW_OFFSET_TAG_INDEX = 4;

    private final String name;
    private final ByteBuffer data;
    private final int stateCount;
    private final int rowLength;
    private final int flags;
    private final int categoryCount;

    /**
     * @param name section name used in error messages
     * @param section buffer holding exactly the section's declared bytes
     * @param categoryCount category count from the blob header
     * @throws InvalidRuleDataException if the table is inconsistent with its size or the category count
     */
    StateTable(String name, ByteBuffer section, int categoryCount) {
        this.name = name;
        this.data = section.order(RuleDataFormat.BYTE_ORDER);
        this.categoryCount = categoryCount;
        if (section.limit() < RuleDataFormat.STATE_TABLE_HEADER_SIZE) {
            throw new InvalidRuleDataException(name + " table is shorter than its header: " + section.limit());
        }
        this.stateCount = data.getInt(0);
        this.rowLength = data.getInt(4);
        this.flags = data.getInt(8);

        if (rowLength != RuleDataFormat.rowLength(categoryCount)) {
            throw new InvalidRuleDataException(String.format(
                    "%s table row length %d does not match %d categories", name, rowLength, categoryCount));
        }
        if (stateCount < 2 || stateCount > RuleDataFormat.MAX_STATES) {
            throw new InvalidRuleDataException(name + " table has an invalid state count: " + stateCount);
        }
        long expected = RuleDataFormat.stateTableSize(stateCount, categoryCount);
        if (expected != section.limit()) {
            throw new InvalidRuleDataException(String.format(
                    "%s table length %d, expected %d for %d states", name, section.limit(), expected, stateCount));
        }
        checkTransitions();
    }

    private void checkTransitions() {
        for (int state = 0; state < stateCount; state++) {
            for (int category = 0; category < categoryCount; category++) {
                int target = next(state, category);
                if (target >= stateCount) {
                    throw new InvalidRuleDataException(String.format(
                            "%s table: state %d category %d goes to missing state %d",
                            name, state, category, target));
                }
            }
        }
    }

    public int stateCount() {
        return stateCount;
    }

    public int rowLength() {
        return rowLength;
    }

    public int flags() {
        return flags;
    }

    public boolean lookAheadHardBreak() {
        return (flags & RuleDataFormat.FLAG_LOOKAHEAD_HARD_BREAK) != 0;
    }

    public boolean bofRequired() {
        return (flags & RuleDataFormat.FLAG_BOF_REQUIRED) != 0;
    }

    public int accepting(int state) {
        return data.getShort(rowStart(state) + ROW_OFFSET_ACCEPTING);
    }

    public int lookAhead(int state) {
        return data.getShort(rowStart(state) + ROW_OFFSET_LOOKAHEAD);
    }

    public int tagIndex(int state) {
        return data.getShort(rowStart(state) + ROW_OFFSET_TAG_INDEX);
    }

    public int next(int state, int category) {
        if (category < 0 || category >= categoryCount) {
            throw new IndexOutOfBoundsException("Category " + category + " of " + categoryCount);
        }
        return Short.toUnsignedInt(data.getShort(rowStart(state) + RuleDataFormat.ROW_HEADER_SIZE + 2 * category));
    }

    private int rowStart(int state) {
        if (state < 0 || state >= stateCount) {
            throw new IndexOutOfBoundsException("State " + state + " of " + stateCount);
        }
        return RuleDataFormat.STATE_TABLE_HEADER_SIZE + state * rowLength;
    }

    @Override
    public String toString() {
        return name + "StateTable{states=" + stateCount + ", categories=" + categoryCount + ", flags=" + flags + "}";
    }
}
