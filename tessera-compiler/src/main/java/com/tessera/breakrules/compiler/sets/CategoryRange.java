/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.sets;

/**
 * A contiguous run of code points sharing one character category.
 *
 * @param start first code point
 * @param end last code point, inclusive
 * @param category the category number
 */
public record CategoryRange(int start, int end, int category) {
}
