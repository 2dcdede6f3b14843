/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.api.model;

/**
 * Position of a syntax error in the rule source.
 *
 * @param line 1-based line number
 * @param offset 0-based code point offset within the line
 * @param preContext up to 15 characters preceding the error
 * @param postContext up to 15 characters starting at the error
 */
public record ParseErrorLocation(int line, int offset, String preContext, String postContext) {

    public static final int MAX_CONTEXT = 15;

    public ParseErrorLocation {
        if (line < 1) {
            throw new IllegalArgumentException("line must be 1-based: " + line);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        preContext = preContext == null ? "" : preContext;
        postContext = postContext == null ? "" : postContext;
    }

    @Override
    public String toString() {
        return "line " + line + ", offset " + offset
                + " [" + preContext + "<<>>" + postContext + "]";
    }
}
