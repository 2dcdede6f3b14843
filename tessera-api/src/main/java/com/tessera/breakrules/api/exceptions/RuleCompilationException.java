/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.api.exceptions;

import com.tessera.breakrules.api.model.RuleErrorCode;

/**
 * Thrown when break rules cannot be compiled.
 */
public class RuleCompilationException extends RuntimeException {

    private final RuleErrorCode errorCode;

    public RuleCompilationException(RuleErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RuleCompilationException(RuleErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public RuleCompilationException(RuleErrorCode errorCode, Throwable cause) {
        super(errorCode.description(), cause);
        this.errorCode = errorCode;
    }

    public RuleErrorCode getErrorCode() {
        return errorCode;
    }
}
