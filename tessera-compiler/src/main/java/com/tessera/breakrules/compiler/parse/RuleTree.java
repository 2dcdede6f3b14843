/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.parse;

/**
 * The four rule trees a rule source may populate.
 */
public enum RuleTree {
    FORWARD("forward"),
    REVERSE("reverse"),
    SAFE_FORWARD("safe_forward"),
    SAFE_REVERSE("safe_reverse");

    private final String optionName;

    RuleTree(String optionName) {
        this.optionName = optionName;
    }

    /** Name of the {@code !!} option that directs later rules to this tree. */
    public String optionName() {
        return optionName;
    }
}
