/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.flatten;

import com.tessera.breakrules.api.exceptions.RuleCompilationException;
import com.tessera.breakrules.api.model.RuleErrorCode;
import com.tessera.breakrules.compiler.sets.CategoryBuilder;
import com.tessera.breakrules.compiler.table.TableBuilder;
import com.tessera.breakrules.runtime.model.RuleDataFormat;
import com.tessera.breakrules.runtime.model.RuleDataHeader;
import com.tessera.breakrules.runtime.model.Section;
import it.unimi.dsi.fastutil.ints.IntList;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Packs the compiled tables, trie, status values and rule source into one blob.
 *
 * <p>The layout is computed first; the blob is then allocated zero-filled and
 * each section is written once into its own slice. A section that writes more
 * or fewer bytes than it announced is an internal error.
 */
public final class RuleDataFlattener {

    private static final Logger logger = Logger.getLogger(RuleDataFlattener.class.getName());

    private record PendingSection(DataLayout.Entry entry, Consumer<ByteBuffer> writer) {
    }

    private final List<PendingSection> sections = new ArrayList<>();
    private final int categoryCount;

    public RuleDataFlattener(TableBuilder tables, CategoryBuilder categories, IntList statusValues,
                             String strippedRules) {
        this.categoryCount = categories.getNumCharCategories();
        add(DataLayout.Entry.of(Section.FORWARD_TABLE, tables.getTableSize()), tables::exportTable);
        add(DataLayout.Entry.of(Section.SAFE_TABLE, tables.getSafeTableSize()), tables::exportSafeTable);
        add(DataLayout.Entry.of(Section.TRIE, categories.getTrieSize()), categories::serializeTrie);
        add(DataLayout.Entry.of(Section.STATUS_TABLE, (long) statusValues.size() * Integer.BYTES), dest -> {
            for (int value : statusValues) {
                dest.putInt(value);
            }
        });
        long sourceBytes = (long) strippedRules.length() * Character.BYTES;
        add(new DataLayout.Entry(Section.RULE_SOURCE, sourceBytes, sourceBytes + Character.BYTES), dest -> {
            for (int i = 0; i < strippedRules.length(); i++) {
                dest.putChar(strippedRules.charAt(i));
            }
            dest.putChar('\0');
        });
    }

    private void add(DataLayout.Entry entry, Consumer<ByteBuffer> writer) {
        sections.add(new PendingSection(entry, writer));
    }

    public DataLayout layout() {
        List<DataLayout.Entry> entries = new ArrayList<>(sections.size());
        for (PendingSection section : sections) {
            entries.add(section.entry());
        }
        return DataLayout.compute(entries);
    }

    /**
     * Produces the blob.
     *
     * @throws RuleCompilationException with {@code MEMORY_ALLOCATION_ERROR} if the blob cannot be allocated,
     *                                  or {@code INTERNAL_ERROR} if a section writes an unexpected size
     */
    public byte[] flatten() {
        DataLayout layout = layout();
        byte[] data;
        try {
            data = new byte[layout.totalLength()];
        } catch (OutOfMemoryError e) {
            throw new RuleCompilationException(RuleErrorCode.MEMORY_ALLOCATION_ERROR,
                    "Cannot allocate " + layout.totalLength() + " bytes of rule data");
        }
        ByteBuffer buffer = ByteBuffer.wrap(data).order(RuleDataFormat.BYTE_ORDER);

        RuleDataHeader.Builder header = RuleDataHeader.builder()
                .length(layout.totalLength())
                .categoryCount(categoryCount);
        layout.extents().forEach(header::section);
        header.build().writeTo(buffer);

        for (PendingSection pending : sections) {
            Section section = pending.entry().section();
            int offset = layout.extent(section).offset();
            int expected = layout.storageLength(section);
            ByteBuffer slice = buffer.slice(offset, layout.paddedLength(section)).order(RuleDataFormat.BYTE_ORDER);
            pending.writer().accept(slice);
            if (slice.position() != expected) {
                throw new RuleCompilationException(RuleErrorCode.INTERNAL_ERROR, String.format(
                        "Section %s wrote %d bytes, expected %d", section, slice.position(), expected));
            }
        }

        logger.fine(() -> "Flattened rule data: " + layout);
        return data;
    }
}
