/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.table;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * One row of the forward state table under construction.
 *
 * <p>{@code positions} holds the parse tree positions the state stands for;
 * it is only meaningful while the table is being built.
 */
final class StateDescriptor {

    final IntSortedSet positions;
    final IntArrayList dtran;
    int accepting;
    int lookAhead;
    int tagIndex;
    final IntSortedSet tagValues = new IntRBTreeSet();
    boolean marked;

    StateDescriptor(int numCategories, IntSortedSet positions) {
        this.positions = positions;
        this.dtran = new IntArrayList(numCategories);
        this.dtran.size(numCategories);
    }

    int next(int category) {
        return dtran.getInt(category);
    }
}
