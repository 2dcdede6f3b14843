/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.parse;

/**
 * Global {@code !!} options found in the rule source.
 *
 * @param chainRules {@code !!chain}: a match may continue into a following rule
 * @param lbcmNoChain {@code !!LBCMNoChain}: never chain out of a combining mark
 * @param lookAheadHardBreak {@code !!lookAheadHardBreak}: look-ahead matches force a break
 * @param quotedLiteralsOnly {@code !!quoted_literals_only}: bare literal characters are rejected
 */
public record RuleOptions(boolean chainRules, boolean lbcmNoChain, boolean lookAheadHardBreak,
                          boolean quotedLiteralsOnly) {
}
