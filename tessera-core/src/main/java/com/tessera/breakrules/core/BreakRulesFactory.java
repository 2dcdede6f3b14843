/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.core;

import com.tessera.breakrules.api.IRuleCompiler;
import com.tessera.breakrules.api.exceptions.InvalidRuleDataException;
import com.tessera.breakrules.api.exceptions.RuleCompilationException;
import com.tessera.breakrules.api.exceptions.RuleSyntaxException;
import com.tessera.breakrules.api.model.CompileResult;
import com.tessera.breakrules.api.model.RuleErrorCode;
import com.tessera.breakrules.compiler.RuleCompiler;
import com.tessera.breakrules.infra.metrics.MetricsRegistry;
import com.tessera.breakrules.runtime.BreakRules;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point turning break rule source text into ready-to-use {@link BreakRules}.
 *
 * <p>Compiles the text, hands the blob to the runtime wrapper and records
 * the outcome:
 * <ul>
 *   <li>{@value #METRIC_COMPILED}: successful compilations</li>
 *   <li>{@value #METRIC_FAILURES}: failures, tagged {@code code=<RuleErrorCode>}</li>
 *   <li>{@value #METRIC_LATENCY}: compile latency, successful or not</li>
 *   <li>{@value #METRIC_DATA_BYTES}: size of the last blob produced</li>
 * </ul>
 *
 * <p>Either a fully validated {@link BreakRules} is returned or an exception
 * is thrown; nothing partially built escapes.
 */
public final class BreakRulesFactory {

    private static final Logger logger = Logger.getLogger(BreakRulesFactory.class.getName());

    public static final String METRIC_COMPILED = "rules_compiled_total";
    public static final String METRIC_FAILURES = "rules_compile_failures_total";
    public static final String METRIC_LATENCY = "rules_compile_latency";
    public static final String METRIC_DATA_BYTES = "rules_data_bytes";

    private final IRuleCompiler compiler;
    private final MetricsRegistry metrics;

    public BreakRulesFactory() {
        this(new RuleCompiler(), MetricsRegistry.getInstance());
    }

    public BreakRulesFactory(IRuleCompiler compiler, MetricsRegistry metrics) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Compiles {@code rules} with a default factory.
     *
     * @see #createMatcher(String)
     */
    public static BreakRules create(String rules) {
        return new BreakRulesFactory().createMatcher(rules);
    }

    /**
     * Compiles {@code rules} and wraps the result.
     *
     * @throws RuleSyntaxException if the rule text is malformed; carries the error location
     * @throws RuleCompilationException if compilation fails for any other reason
     * @throws InvalidRuleDataException if the produced blob is rejected by the runtime
     */
    public BreakRules createMatcher(String rules) {
        Objects.requireNonNull(rules, "rules");
        long start = System.nanoTime();
        CompileResult result;
        try {
            result = compiler.compile(rules);
        } finally {
            metrics.timer(METRIC_LATENCY).record(Duration.ofNanos(System.nanoTime() - start));
        }

        if (!result.isSuccess()) {
            recordFailure(result.status().errorCode());
            logger.warning("Break rules did not compile: " + result.status());
        }
        byte[] data = result.orElseThrow();

        BreakRules breakRules = wrap(data);
        metrics.counter(METRIC_COMPILED).increment();
        metrics.gauge(METRIC_DATA_BYTES).set(data.length);
        logger.fine(() -> "Created " + breakRules);
        return breakRules;
    }

    private BreakRules wrap(byte[] data) {
        try {
            return new BreakRules(data);
        } catch (InvalidRuleDataException e) {
            recordFailure(e.getErrorCode());
            logger.log(Level.SEVERE, "Compiler produced rule data the runtime rejects", e);
            throw e;
        }
    }

    private void recordFailure(RuleErrorCode code) {
        metrics.counter(METRIC_FAILURES, "code", code.name()).increment();
    }
}
