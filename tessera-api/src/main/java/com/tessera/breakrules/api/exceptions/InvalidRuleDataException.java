/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.api.exceptions;

import com.tessera.breakrules.api.model.RuleErrorCode;

/**
 * Thrown when a rule data blob fails structural validation.
 */
public class InvalidRuleDataException extends RuleCompilationException {

    public InvalidRuleDataException(String message) {
        super(RuleErrorCode.INVALID_FORMAT, message);
    }

    public InvalidRuleDataException(String message, Throwable cause) {
        super(RuleErrorCode.INVALID_FORMAT, message, cause);
    }
}
