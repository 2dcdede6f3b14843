/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.flatten;

import com.tessera.breakrules.api.exceptions.RuleCompilationException;
import com.tessera.breakrules.api.model.RuleErrorCode;
import com.tessera.breakrules.runtime.model.RuleDataFormat;
import com.tessera.breakrules.runtime.model.Section;
import com.tessera.breakrules.runtime.model.SectionExtent;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Placement of every section in the flattened blob.
 *
 * <p>The header comes first; sections follow in data order, each starting on
 * an 8-byte boundary. A section's declared length may be shorter than the
 * bytes it stores (the rule source keeps its terminator outside the declared
 * length).
 */
public final class DataLayout {

    /**
     * One section to place.
     *
     * @param section which section
     * @param length length recorded in the header
     * @param storageLength bytes actually written, at least {@code length}
     */
    public record Entry(Section section, long length, long storageLength) {

        public Entry {
            if (length < 0 || storageLength < length) {
                throw new IllegalArgumentException("Invalid sizes for " + section
                        + ": length=" + length + ", storageLength=" + storageLength);
            }
        }

        public static Entry of(Section section, long length) {
            return new Entry(section, length, length);
        }
    }

    private final Map<Section, SectionExtent> extents;
    private final Map<Section, Integer> storageLengths;
    private final int totalLength;

    private DataLayout(Map<Section, SectionExtent> extents, Map<Section, Integer> storageLengths, int totalLength) {
        this.extents = Collections.unmodifiableMap(extents);
        this.storageLengths = Collections.unmodifiableMap(storageLengths);
        this.totalLength = totalLength;
    }

    /**
     * Lays out {@code entries}, which must name each section once, in data order.
     *
     * @throws RuleCompilationException with {@code MEMORY_ALLOCATION_ERROR} if the blob would exceed 2 GiB
     */
    public static DataLayout compute(List<Entry> entries) {
        Map<Section, SectionExtent> extents = new EnumMap<>(Section.class);
        Map<Section, Integer> storage = new EnumMap<>(Section.class);
        long offset = RuleDataFormat.align8(RuleDataFormat.HEADER_SIZE);
        Section previous = null;
        for (Entry entry : entries) {
            if (previous != null && entry.section().ordinal() <= previous.ordinal()) {
                throw new IllegalArgumentException("Section " + entry.section() + " out of order after " + previous);
            }
            previous = entry.section();
            long end = offset + RuleDataFormat.align8(entry.storageLength());
            if (end > Integer.MAX_VALUE) {
                throw new RuleCompilationException(RuleErrorCode.MEMORY_ALLOCATION_ERROR,
                        "Rule data would need " + end + " bytes");
            }
            extents.put(entry.section(), new SectionExtent((int) offset, (int) entry.length()));
            storage.put(entry.section(), (int) entry.storageLength());
            offset = end;
        }
        return new DataLayout(extents, storage, (int) offset);
    }

    public SectionExtent extent(Section section) {
        SectionExtent extent = extents.get(section);
        if (extent == null) {
            throw new IllegalArgumentException("Section not in layout: " + section);
        }
        return extent;
    }

    public int storageLength(Section section) {
        extent(section);
        return storageLengths.get(section);
    }

    /**
     * Bytes reserved for {@code section}, padding included.
     */
    public int paddedLength(Section section) {
        return (int) RuleDataFormat.align8(storageLength(section));
    }

    public Map<Section, SectionExtent> extents() {
        return extents;
    }

    public int totalLength() {
        return totalLength;
    }

    @Override
    public String toString() {
        return "DataLayout{totalLength=" + totalLength + ", extents=" + extents + "}";
    }
}
