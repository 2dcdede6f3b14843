/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.runtime.model;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The fixed 80-byte header at the start of every rule data blob.
 *
 * <h2>Fields</h2>
 * <table>
 *   <caption>Header fields (all little-endian uint32)</caption>
 *   <tr><th>Offset</th><th>Field</th></tr>
 *   <tr><td>0</td><td>magic</td></tr>
 *   <tr><td>4</td><td>format version bytes</td></tr>
 *   <tr><td>8</td><td>total length</td></tr>
 *   <tr><td>12</td><td>category count</td></tr>
 *   <tr><td>16..55</td><td>section offset/length pairs, see {@link Section}</td></tr>
 *   <tr><td>56..79</td><td>reserved, zero</td></tr>
 * </table>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * RuleDataHeader header = RuleDataHeader.builder()
 *     .length(total)
 *     .categoryCount(categories)
 *     .section(Section.FORWARD_TABLE, new SectionExtent(80, forwardLength))
 *     ...
 *     .build();
 * header.writeTo(buffer);
 * }</pre>
 */
public final class RuleDataHeader {

    private final int magic;
    private final byte[] formatVersion;
    private final int length;
    private final int categoryCount;
    private final Map<Section, SectionExtent> sections;

    private RuleDataHeader(Builder builder) {
        this.magic = builder.magic;
        this.formatVersion = builder.formatVersion.clone();
        this.length = builder.length;
        this.categoryCount = builder.categoryCount;
        this.sections = Collections.unmodifiableMap(new EnumMap<>(builder.sections));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a header from the start of {@code data}. Performs no validation
     * beyond the buffer being large enough to hold the header.
     *
     * @param data buffer positioned anywhere; read with absolute offsets
     * @return the decoded header
     * @throws IllegalArgumentException if fewer than 80 bytes are available
     */
    public static RuleDataHeader readFrom(ByteBuffer data) {
        if (data.limit() < RuleDataFormat.HEADER_SIZE) {
            throw new IllegalArgumentException("Buffer holds " + data.limit()
                    + " bytes, header needs " + RuleDataFormat.HEADER_SIZE);
        }
        ByteBuffer in = data.duplicate().order(RuleDataFormat.BYTE_ORDER);
        byte[] version = new byte[4];
        for (int i = 0; i < version.length; i++) {
            version[i] = in.get(RuleDataFormat.OFFSET_FORMAT_VERSION + i);
        }
        Builder builder = builder()
                .magic(in.getInt(RuleDataFormat.OFFSET_MAGIC))
                .formatVersion(version)
                .length(in.getInt(RuleDataFormat.OFFSET_LENGTH))
                .categoryCount(in.getInt(RuleDataFormat.OFFSET_CATEGORY_COUNT));
        for (Section section : Section.values()) {
            int offset = in.getInt(section.offsetField());
            int len = in.getInt(section.lengthField());
            if (offset < 0 || len < 0) {
                throw new IllegalArgumentException("Section " + section + " has a negative extent");
            }
            builder.section(section, new SectionExtent(offset, len));
        }
        return builder.build();
    }

    /**
     * Writes the header into the first 80 bytes of {@code out} using absolute puts.
     * Reserved bytes are left untouched; callers write into a zero-filled buffer.
     */
    public void writeTo(ByteBuffer out) {
        ByteBuffer dest = out.duplicate().order(RuleDataFormat.BYTE_ORDER);
        dest.putInt(RuleDataFormat.OFFSET_MAGIC, magic);
        for (int i = 0; i < formatVersion.length; i++) {
            dest.put(RuleDataFormat.OFFSET_FORMAT_VERSION + i, formatVersion[i]);
        }
        dest.putInt(RuleDataFormat.OFFSET_LENGTH, length);
        dest.putInt(RuleDataFormat.OFFSET_CATEGORY_COUNT, categoryCount);
        for (Map.Entry<Section, SectionExtent> entry : sections.entrySet()) {
            dest.putInt(entry.getKey().offsetField(), entry.getValue().offset());
            dest.putInt(entry.getKey().lengthField(), entry.getValue().length());
        }
    }

    public int magic() {
        return magic;
    }

    public byte[] formatVersion() {
        return formatVersion.clone();
    }

    public int length() {
        return length;
    }

    public int categoryCount() {
        return categoryCount;
    }

    public SectionExtent section(Section section) {
        SectionExtent extent = sections.get(section);
        return extent == null ? new SectionExtent(0, 0) : extent;
    }

    public Map<Section, SectionExtent> sections() {
        return sections;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RuleDataHeader that)) return false;
        return magic == that.magic
                && length == that.length
                && categoryCount == that.categoryCount
                && Arrays.equals(formatVersion, that.formatVersion)
                && sections.equals(that.sections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(magic, Arrays.hashCode(formatVersion), length, categoryCount, sections);
    }

    @Override
    public String toString() {
        return String.format("RuleDataHeader{magic=0x%X, version=%s, length=%d, categories=%d, sections=%s}",
                magic, Arrays.toString(formatVersion), length, categoryCount, sections);
    }

    public static final class Builder {
        private int magic = RuleDataFormat.MAGIC;
        private byte[] formatVersion = RuleDataFormat.formatVersion();
        private int length;
        private int categoryCount;
        private final Map<Section, SectionExtent> sections = new EnumMap<>(Section.class);

        private Builder() {
        }

        public Builder magic(int magic) {
            this.magic = magic;
            return this;
        }

        public Builder formatVersion(byte[] formatVersion) {
            if (formatVersion.length != 4) {
                throw new IllegalArgumentException("Format version must be 4 bytes");
            }
            this.formatVersion = formatVersion.clone();
            return this;
        }

        public Builder length(int length) {
            this.length = length;
            return this;
        }

        public Builder categoryCount(int categoryCount) {
            this.categoryCount = categoryCount;
            return this;
        }

        public Builder section(Section section, SectionExtent extent) {
            sections.put(Objects.requireNonNull(section), Objects.requireNonNull(extent));
            return this;
        }

        public RuleDataHeader build() {
            return new RuleDataHeader(this);
        }
    }
}
