/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.api.model;

import com.tessera.breakrules.api.exceptions.RuleCompilationException;
import com.tessera.breakrules.api.exceptions.RuleSyntaxException;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of compiling rule text: either the flattened blob or a failure status.
 *
 * <p>The blob is owned by the caller. A failed result never carries a blob.
 */
public record CompileResult(byte[] data, CompileStatus status, CompileStats stats) {

    public CompileResult {
        Objects.requireNonNull(status, "status");
        if (status.isFailure() && data != null) {
            throw new IllegalArgumentException("Failed compile result must not carry data");
        }
        if (status.isSuccess() && data == null) {
            throw new IllegalArgumentException("Successful compile result requires data");
        }
        stats = stats == null ? CompileStats.EMPTY : stats;
    }

    public static CompileResult success(byte[] data, CompileStats stats) {
        return new CompileResult(data, CompileStatus.ok(), stats);
    }

    public static CompileResult failure(CompileStatus status, CompileStats stats) {
        return new CompileResult(null, status, stats);
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }

    public Optional<byte[]> blob() {
        return Optional.ofNullable(data);
    }

    /**
     * Returns the blob, or throws the failure as an exception.
     *
     * @throws RuleSyntaxException if the failure carries a source location
     * @throws RuleCompilationException for any other failure
     */
    public byte[] orElseThrow() {
        if (status.isSuccess()) {
            return data;
        }
        if (status.location() != null) {
            throw new RuleSyntaxException(status.errorCode(), status.message(), status.location());
        }
        throw new RuleCompilationException(status.errorCode(), status.message());
    }
}
