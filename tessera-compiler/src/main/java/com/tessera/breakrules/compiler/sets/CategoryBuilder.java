/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.sets;

import com.tessera.breakrules.api.exceptions.RuleCompilationException;
import com.tessera.breakrules.api.model.CharCategory;
import com.tessera.breakrules.api.model.RuleErrorCode;
import com.tessera.breakrules.compiler.parse.SetLeaf;
import com.tessera.breakrules.compiler.table.IntPair;
import com.tessera.breakrules.runtime.model.RuleDataFormat;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Partitions the code space into character categories.
 *
 * <p>Code points that belong to exactly the same set leaves share a category.
 * Categories 0, 1 and 2 are reserved ({@link CharCategory}); code points no
 * rule mentions stay in category 0. User categories are numbered from 3 in
 * code point order of their first range.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>{@link #buildRanges()} once, after parsing</li>
 *   <li>{@link #mergeCategories(IntPair)} any number of times during table minimization</li>
 *   <li>{@link #buildTrie()} once, then {@link #serializeTrie(ByteBuffer)}</li>
 * </ol>
 */
public final class CategoryBuilder {

    private static final Logger logger = Logger.getLogger(CategoryBuilder.class.getName());

    private static final int LIMIT = RuleDataFormat.MAX_CODE_POINT + 1;

    private final List<SetLeaf> setLeaves;
    private final List<MutableRange> ranges = new ArrayList<>();
    private int groupCount;
    private boolean sawBOF;
    private boolean rangesBuilt;
    private TrieBuilder.CategoryTrie trie;

    public CategoryBuilder(List<SetLeaf> setLeaves) {
        this.setLeaves = setLeaves;
    }

    /**
     * Splits the code space at every set boundary, groups the pieces by set
     * membership and numbers the groups. Each set leaf then lists the
     * categories it covers, followed by {@code BEGIN_OF_TEXT} and
     * {@code END_OF_TEXT} where the set contains {@code {bof}} / {@code {eof}}.
     */
    public void buildRanges() {
        if (rangesBuilt) {
            throw new IllegalStateException("Ranges already built");
        }
        rangesBuilt = true;

        IntSortedSet boundaries = new IntRBTreeSet();
        boundaries.add(0);
        boundaries.add(LIMIT);
        for (SetLeaf leaf : setLeaves) {
            CodePointSet set = leaf.codePoints();
            for (int r = 0; r < set.rangeCount(); r++) {
                boundaries.add(set.rangeStart(r));
                boundaries.add(set.rangeEnd(r) + 1);
            }
        }

        int[] cuts = boundaries.toIntArray();
        MutableRange previous = null;
        for (int i = 0; i + 1 < cuts.length; i++) {
            IntArrayList members = new IntArrayList();
            for (SetLeaf leaf : setLeaves) {
                if (leaf.codePoints().contains(cuts[i])) {
                    members.add(leaf.index());
                }
            }
            if (previous != null && previous.members.equals(members)) {
                previous.end = cuts[i + 1] - 1;
                continue;
            }
            previous = new MutableRange(cuts[i], cuts[i + 1] - 1, members);
            ranges.add(previous);
        }

        Object2IntOpenHashMap<IntArrayList> groups = new Object2IntOpenHashMap<>();
        groups.defaultReturnValue(-1);
        for (MutableRange range : ranges) {
            if (range.members.isEmpty()) {
                range.category = CharCategory.UNUSED.value();
                continue;
            }
            int category = groups.getInt(range.members);
            if (category < 0) {
                category = CharCategory.FIRST_USER_CATEGORY + groupCount++;
                groups.put(range.members, category);
                for (int leafIndex : range.members) {
                    setLeaves.get(leafIndex).addCategory(category);
                }
            }
            range.category = category;
        }

        for (SetLeaf leaf : setLeaves) {
            if (leaf.containsBeginOfText()) {
                leaf.addCategory(CharCategory.BEGIN_OF_TEXT.value());
                sawBOF = true;
            }
            if (leaf.containsEndOfText()) {
                leaf.addCategory(CharCategory.END_OF_TEXT.value());
            }
        }

        logger.fine(() -> String.format("Built %d ranges in %d categories from %d sets",
                ranges.size(), getNumCharCategories(), setLeaves.size()));
    }

    /**
     * Total number of categories, reserved ones included.
     */
    public int getNumCharCategories() {
        return groupCount + CharCategory.FIRST_USER_CATEGORY;
    }

    /**
     * Folds category {@code pair.second()} into {@code pair.first()} and
     * renumbers every higher category down by one.
     *
     * @throws RuleCompilationException with {@code INTERNAL_ERROR} if either side is reserved
     */
    public void mergeCategories(IntPair pair) {
        int keep = pair.first();
        int drop = pair.second();
        if (CharCategory.isReserved(keep) || CharCategory.isReserved(drop)) {
            throw new RuleCompilationException(RuleErrorCode.INTERNAL_ERROR,
                    "Attempt to merge reserved category: " + pair);
        }
        if (drop <= keep || drop >= getNumCharCategories()) {
            throw new RuleCompilationException(RuleErrorCode.INTERNAL_ERROR,
                    "Invalid category merge: " + pair);
        }
        for (MutableRange range : ranges) {
            if (range.category == drop) {
                range.category = keep;
            } else if (range.category > drop) {
                range.category--;
            }
        }
        groupCount--;
    }

    /**
     * First code point in {@code category}, or -1 if no code point maps to it.
     */
    public int getFirstChar(int category) {
        for (MutableRange range : ranges) {
            if (range.category == category) {
                return range.start;
            }
        }
        return -1;
    }

    public boolean sawBOF() {
        return sawBOF;
    }

    public int categoryOf(int codePoint) {
        for (MutableRange range : ranges) {
            if (codePoint >= range.start && codePoint <= range.end) {
                return range.category;
            }
        }
        return CharCategory.UNUSED.value();
    }

    /**
     * Current ranges, adjacent ranges with equal categories coalesced.
     */
    public List<CategoryRange> ranges() {
        List<CategoryRange> result = new ArrayList<>();
        for (MutableRange range : ranges) {
            int last = result.size() - 1;
            if (last >= 0 && result.get(last).category() == range.category) {
                CategoryRange merged = new CategoryRange(result.get(last).start(), range.end, range.category);
                result.set(last, merged);
            } else {
                result.add(new CategoryRange(range.start, range.end, range.category));
            }
        }
        return Collections.unmodifiableList(result);
    }

    public void buildTrie() {
        if (!rangesBuilt) {
            throw new IllegalStateException("Ranges not built");
        }
        trie = TrieBuilder.build(ranges());
        logger.fine(() -> String.format("Trie: index1=%d index2=%d data=%d highStart=0x%X",
                trie.index1Length(), trie.index2Length(), trie.dataLength(), trie.highStart()));
    }

    public int getTrieSize() {
        return trie == null ? 0 : trie.serializedSize();
    }

    /**
     * Writes the trie at {@code dest}'s position; the buffer's byte order is used.
     */
    public void serializeTrie(ByteBuffer dest) {
        if (trie == null) {
            throw new IllegalStateException("Trie not built");
        }
        trie.writeTo(dest);
    }

    public TrieBuilder.CategoryTrie trie() {
        return trie;
    }

    public String describeRanges() {
        StringBuilder sb = new StringBuilder("Category ranges\n");
        for (CategoryRange range : ranges()) {
            sb.append(String.format("  %06X-%06X  %3d%n", range.start(), range.end(), range.category()));
        }
        sb.append("Set leaves\n");
        for (SetLeaf leaf : setLeaves) {
            sb.append("  ").append(leaf.sourceText()).append(" -> ").append(leaf.categories()).append('\n');
        }
        return sb.toString();
    }

    private static final class MutableRange {
        final int start;
        int end;
        final IntArrayList members;
        int category;

        MutableRange(int start, int end, IntArrayList members) {
            this.start = start;
            this.end = end;
            this.members = members;
        }
    }
}
