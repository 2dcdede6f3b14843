/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.api.exceptions;

import com.tessera.breakrules.api.model.ParseErrorLocation;
import com.tessera.breakrules.api.model.RuleErrorCode;

/**
 * Syntax error in rule source, with the location where it was detected.
 */
public class RuleSyntaxException extends RuleCompilationException {

    private final ParseErrorLocation location;
    private final String reason;

    public RuleSyntaxException(RuleErrorCode errorCode, String reason, ParseErrorLocation location) {
        super(errorCode, reason + " at " + location);
        this.location = location;
        this.reason = reason;
    }

    /**
     * Returns the message without the location suffix.
     */
    public String getReason() {
        return reason;
    }

    public ParseErrorLocation getLocation() {
        return location;
    }
}
