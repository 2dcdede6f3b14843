/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.table;

/**
 * What one run of {@link TableMinimizer#minimize()} did.
 *
 * @param passes outer iterations, including the final one that changed nothing
 * @param columnsMerged categories folded into another category
 * @param statesMerged forward table states removed
 */
public record MinimizationReport(int passes, int columnsMerged, int statesMerged) {

    public boolean changedAnything() {
        return columnsMerged > 0 || statesMerged > 0;
    }
}
