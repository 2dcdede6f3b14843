/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler;

import com.tessera.breakrules.api.CompilationListener;
import com.tessera.breakrules.api.IRuleCompiler;
import com.tessera.breakrules.api.model.CompileResult;
import com.tessera.breakrules.api.model.CompileStatus;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Compiles break rule source text into a rule data blob.
 *
 * <p>Each call to {@link #compile(String)} uses a fresh {@link RuleBuilder};
 * the compiler itself keeps no per-compile state and may be reused. Bad rules
 * never throw: the result carries the failure status instead.
 */
public class RuleCompiler implements IRuleCompiler {

    private static final Logger logger = Logger.getLogger(RuleCompiler.class.getName());

    private final CompilerConfig config;
    private Tracer tracer;
    private CompilationListener listener;

    public RuleCompiler() {
        this(OpenTelemetry.noop().getTracer("tessera-compiler"));
    }

    public RuleCompiler(Tracer tracer) {
        this(tracer, CompilerConfig.defaults());
    }

    public RuleCompiler(Tracer tracer, CompilerConfig config) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public CompileResult compile(String rules) {
        Objects.requireNonNull(rules, "rules");
        Span span = tracer.spanBuilder("compile-rules").startSpan();
        try (Scope scope = span.makeCurrent();
             RuleBuilder builder = new RuleBuilder(rules, CompileStatus.ok(), config, tracer, listener)) {
            span.setAttribute("ruleTextLength", rules.length());
            CompileResult result = builder.build();

            span.setAttribute("success", result.isSuccess());
            if (result.isSuccess()) {
                span.setAttribute("dataLength", result.stats().dataLength());
                logger.info(String.format(
                        "Compiled break rules: %d bytes, %d categories, %d states (%d before), %d safe states in %.2f ms",
                        result.stats().dataLength(),
                        result.stats().categoriesAfterOptimization(),
                        result.stats().statesAfterOptimization(),
                        result.stats().statesBeforeOptimization(),
                        result.stats().safeTableStates(),
                        result.stats().durationMillis()));
            } else {
                span.setAttribute("errorCode", result.status().errorCode().name());
            }
            return result;
        } finally {
            span.end();
        }
    }

    public CompilerConfig config() {
        return config;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener;
    }
}
