/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.table;

import com.tessera.breakrules.api.model.CharCategory;
import com.tessera.breakrules.compiler.sets.CategoryBuilder;

import java.util.logging.Logger;

/**
 * Shrinks the forward table by merging duplicate category columns and
 * duplicate states until neither step finds anything.
 *
 * <p>Merging columns can make states equal and merging states can make
 * columns equal, so both run inside one fixed-point loop. The reserved
 * categories are never merged.
 */
public final class TableMinimizer {

    private static final Logger logger = Logger.getLogger(TableMinimizer.class.getName());

    private final TableBuilder tables;
    private final CategoryBuilder categories;

    public TableMinimizer(TableBuilder tables, CategoryBuilder categories) {
        this.tables = tables;
        this.categories = categories;
    }

    public MinimizationReport minimize() {
        int passes = 0;
        int columnsMerged = 0;
        int statesMerged = 0;
        boolean didSomething;
        do {
            didSomething = false;
            passes++;

            IntPair duplPair = new IntPair(CharCategory.FIRST_USER_CATEGORY, 0);
            while (tables.findDuplCharClassFrom(duplPair)) {
                categories.mergeCategories(duplPair);
                tables.removeColumn(duplPair.second());
                columnsMerged++;
                didSomething = true;
            }

            int removed;
            while ((removed = tables.removeDuplicateStates()) > 0) {
                statesMerged += removed;
                didSomething = true;
            }
        } while (didSomething);

        MinimizationReport report = new MinimizationReport(passes, columnsMerged, statesMerged);
        logger.fine(() -> "Table minimization: " + report);
        return report;
    }
}
