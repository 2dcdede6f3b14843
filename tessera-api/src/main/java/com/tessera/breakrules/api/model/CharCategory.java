/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.api.model;

/**
 * Reserved character categories. User categories are numbered from
 * {@link #FIRST_USER_CATEGORY}.
 */
public enum CharCategory {
    /** Code points not mentioned by any rule. */
    UNUSED(0),
    /** Synthetic category seen once at the start of text. */
    BEGIN_OF_TEXT(1),
    /** Synthetic category seen once at the end of text. */
    END_OF_TEXT(2);

    public static final int FIRST_USER_CATEGORY = 3;

    private final int value;

    CharCategory(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }

    public static boolean isReserved(int category) {
        return category >= 0 && category < FIRST_USER_CATEGORY;
    }

    public static CharCategory of(int category) {
        if (!isReserved(category)) {
            throw new IllegalArgumentException("Not a reserved category: " + category);
        }
        return values()[category];
    }
}
