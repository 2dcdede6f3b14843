/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.api.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a compilation stage, or of a whole compilation.
 *
 * <p>A status is either {@link #ok()} or a failure carrying an error code,
 * a message and, for syntax errors, the location in the rule source.
 */
public record CompileStatus(RuleErrorCode errorCode, String message, ParseErrorLocation location) {

    private static final CompileStatus OK = new CompileStatus(null, null, null);

    public static CompileStatus ok() {
        return OK;
    }

    public static CompileStatus failure(RuleErrorCode code, String message) {
        return failure(code, message, null);
    }

    public static CompileStatus failure(RuleErrorCode code, String message, ParseErrorLocation location) {
        Objects.requireNonNull(code, "code");
        return new CompileStatus(code, message == null ? code.description() : message, location);
    }

    public boolean isSuccess() {
        return errorCode == null;
    }

    public boolean isFailure() {
        return errorCode != null;
    }

    public Optional<ParseErrorLocation> errorLocation() {
        return Optional.ofNullable(location);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "OK";
        }
        return location == null
                ? errorCode + ": " + message
                : errorCode + " at " + location + ": " + message;
    }
}
