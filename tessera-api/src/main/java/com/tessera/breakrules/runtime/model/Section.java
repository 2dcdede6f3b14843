/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.runtime.model;

/**
 * Sections of the rule data blob, declared in data order.
 *
 * <p>Each section owns an offset/length pair in the header. Header slot order
 * differs from data order: the rule source slot precedes the status slot.
 */
public enum Section {
    FORWARD_TABLE(16),
    SAFE_TABLE(24),
    TRIE(32),
    STATUS_TABLE(48),
    RULE_SOURCE(40);

    private final int headerSlot;

    Section(int headerSlot) {
        this.headerSlot = headerSlot;
    }

    /** Header position of this section's offset field. */
    public int offsetField() {
        return headerSlot;
    }

    /** Header position of this section's length field. */
    public int lengthField() {
        return headerSlot + 4;
    }
}
