/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.runtime.model;

/**
 * Byte range of one section inside the blob.
 *
 * @param offset start of the section, a multiple of 8
 * @param length declared length, excluding alignment padding
 */
public record SectionExtent(int offset, int length) {

    public SectionExtent {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Negative extent: offset=" + offset + ", length=" + length);
        }
    }

    public long end() {
        return (long) offset + length;
    }
}
