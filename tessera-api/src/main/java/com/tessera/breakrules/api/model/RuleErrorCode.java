/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.api.model;

/**
 * Failure codes reported by the rule compiler.
 */
public enum RuleErrorCode {
    MEMORY_ALLOCATION_ERROR("Out of memory while building rule data"),
    INTERNAL_ERROR("Internal error in rule compiler"),
    RULE_SYNTAX("Syntax error in rules"),
    UNCLOSED_SET("Set expression is missing its closing ']'"),
    SEMICOLON_EXPECTED("Missing ';' at end of statement"),
    ASSIGN_ERROR("Malformed variable assignment"),
    VARIABLE_REDEFINITION("Variable is defined more than once"),
    UNDEFINED_VARIABLE("Reference to an undefined variable"),
    MISMATCHED_PAREN("Mismatched parentheses"),
    NEW_LINE_IN_QUOTED_STRING("New line inside a quoted string"),
    HEX_DIGITS_EXPECTED("Hex digits expected in escape sequence"),
    UNRECOGNIZED_OPTION("Unrecognized !! option"),
    MALFORMED_RULE_TAG("Malformed {nnn} rule status tag"),
    MALFORMED_SET("Malformed set expression"),
    RULE_EMPTY_SET("Set expression matches no characters"),
    INVALID_FORMAT("Malformed rule data");

    private final String description;

    RuleErrorCode(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * Returns true for codes raised while scanning rule text.
     */
    public boolean isSyntaxError() {
        return ordinal() >= RULE_SYNTAX.ordinal() && this != INVALID_FORMAT;
    }
}
