/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.runtime;

import com.tessera.breakrules.api.exceptions.InvalidRuleDataException;
import com.tessera.breakrules.api.model.CharCategory;
import com.tessera.breakrules.runtime.model.RuleDataFormat;
import com.tessera.breakrules.runtime.model.RuleDataHeader;
import com.tessera.breakrules.runtime.model.Section;
import com.tessera.breakrules.runtime.model.SectionExtent;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.logging.Logger;

/**
 * Compiled break rules, validated and ready to be read.
 *
 * <p>Wraps a rule data blob produced by the rule compiler. The constructor
 * checks the header, the placement of every section and the internal
 * consistency of the state tables and the category trie; once constructed
 * every accessor is safe to call without further checks. The blob is copied,
 * so later changes to the caller's array have no effect.
 *
 * <p>Instances are immutable and thread-safe.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * BreakRules rules = new BreakRules(compileResult.orElseThrow());
 * int category = rules.categoryOf('a');
 * int next = rules.forwardTable().next(1, category);
 * }</pre>
 */
public final class BreakRules {

    private static final Logger logger = Logger.getLogger(BreakRules.class.getName());

    private final byte[] data;
    private final RuleDataHeader header;
    private final StateTable forwardTable;
    private final StateTable safeTable;
    private final CategoryLookup categories;
    private final int[] statusValues;
    private final String ruleSource;

    /**
     * @param blob rule data blob
     * @throws InvalidRuleDataException if the blob is malformed
     */
    public BreakRules(byte[] blob) {
        if (blob == null) {
            throw new InvalidRuleDataException("Rule data is null");
        }
        this.data = blob.clone();
        ByteBuffer buffer = ByteBuffer.wrap(data).order(RuleDataFormat.BYTE_ORDER);
        if (data.length < RuleDataFormat.HEADER_SIZE) {
            throw new InvalidRuleDataException("Rule data holds " + data.length
                    + " bytes, the header alone needs " + RuleDataFormat.HEADER_SIZE);
        }
        this.header = readHeader(buffer);
        checkHeader();

        int categoryCount = header.categoryCount();
        this.forwardTable = new StateTable("Forward", sectionBuffer(buffer, Section.FORWARD_TABLE), categoryCount);
        this.safeTable = new StateTable("Safe", sectionBuffer(buffer, Section.SAFE_TABLE), categoryCount);
        this.categories = new CategoryLookup(sectionBuffer(buffer, Section.TRIE), categoryCount);
        this.statusValues = readStatusValues(sectionBuffer(buffer, Section.STATUS_TABLE));
        this.ruleSource = readRuleSource(buffer);
        checkTagIndexes();

        logger.fine(() -> String.format("Loaded break rules: %d bytes, %d categories, %d states, %d safe states",
                data.length, categoryCount, forwardTable.stateCount(), safeTable.stateCount()));
    }

    private static RuleDataHeader readHeader(ByteBuffer buffer) {
        try {
            return RuleDataHeader.readFrom(buffer);
        } catch (IllegalArgumentException e) {
            throw new InvalidRuleDataException("Unreadable rule data header: " + e.getMessage(), e);
        }
    }

    private void checkHeader() {
        if (header.magic() != RuleDataFormat.MAGIC) {
            throw new InvalidRuleDataException(String.format("Bad magic 0x%X", header.magic()));
        }
        byte[] version = header.formatVersion();
        if (version[0] != RuleDataFormat.FORMAT_VERSION_MAJOR) {
            throw new InvalidRuleDataException("Unsupported format version " + Arrays.toString(version)
                    + ", expected " + RuleDataFormat.formatVersionString());
        }
        if (header.length() != data.length) {
            throw new InvalidRuleDataException("Header declares " + header.length()
                    + " bytes but the blob holds " + data.length);
        }
        if (header.categoryCount() < CharCategory.FIRST_USER_CATEGORY
                || header.categoryCount() > RuleDataFormat.MAX_STATES) {
            throw new InvalidRuleDataException("Invalid category count " + header.categoryCount());
        }
        for (Section section : Section.values()) {
            SectionExtent extent = header.section(section);
            if (extent.offset() % RuleDataFormat.ALIGNMENT != 0) {
                throw new InvalidRuleDataException(section + " offset " + extent.offset() + " is not 8-byte aligned");
            }
            if (extent.offset() < RuleDataFormat.HEADER_SIZE || extent.end() > data.length) {
                throw new InvalidRuleDataException(section + " [" + extent.offset() + ", " + extent.end()
                        + ") lies outside the blob");
            }
        }
    }

    private ByteBuffer sectionBuffer(ByteBuffer buffer, Section section) {
        SectionExtent extent = header.section(section);
        return buffer.slice(extent.offset(), extent.length()).order(RuleDataFormat.BYTE_ORDER);
    }

    private static int[] readStatusValues(ByteBuffer section) {
        if (section.limit() % Integer.BYTES != 0 || section.limit() == 0) {
            throw new InvalidRuleDataException("Status table length " + section.limit()
                    + " is not a positive multiple of 4");
        }
        int[] values = new int[section.limit() / Integer.BYTES];
        for (int i = 0; i < values.length; i++) {
            values[i] = section.getInt(i * Integer.BYTES);
        }
        return values;
    }

    private String readRuleSource(ByteBuffer buffer) {
        SectionExtent extent = header.section(Section.RULE_SOURCE);
        if (extent.length() % Character.BYTES != 0) {
            throw new InvalidRuleDataException("Rule source length " + extent.length() + " is odd");
        }
        if (extent.end() + Character.BYTES > data.length || buffer.getChar((int) extent.end()) != '\0') {
            throw new InvalidRuleDataException("Rule source is not terminated");
        }
        char[] chars = new char[extent.length() / Character.BYTES];
        for (int i = 0; i < chars.length; i++) {
            chars[i] = buffer.getChar(extent.offset() + i * Character.BYTES);
        }
        return new String(chars);
    }

    private void checkTagIndexes() {
        for (int state = 0; state < forwardTable.stateCount(); state++) {
            int tagIndex = forwardTable.tagIndex(state);
            if (tagIndex < 0 || tagIndex >= statusValues.length) {
                throw new InvalidRuleDataException("State " + state + " refers to missing status entry " + tagIndex);
            }
        }
    }

    public RuleDataHeader header() {
        return header;
    }

    public int categoryCount() {
        return header.categoryCount();
    }

    /**
     * Character category of {@code codePoint}.
     */
    public int categoryOf(int codePoint) {
        return categories.categoryOf(codePoint);
    }

    public CategoryLookup categories() {
        return categories;
    }

    public StateTable forwardTable() {
        return forwardTable;
    }

    public StateTable safeTable() {
        return safeTable;
    }

    /**
     * Rule status values; entry 0 is the status of untagged rules.
     */
    public int[] ruleStatusValues() {
        return statusValues.clone();
    }

    /**
     * Rule source text with comments and redundant white space removed.
     */
    public String ruleSource() {
        return ruleSource;
    }

    /**
     * A copy of the underlying blob.
     */
    public byte[] data() {
        return data.clone();
    }

    @Override
    public String toString() {
        return "BreakRules{bytes=" + data.length + ", categories=" + categoryCount()
                + ", states=" + forwardTable.stateCount() + ", safeStates=" + safeTable.stateCount() + "}";
    }
}
