/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.api;

import com.tessera.breakrules.api.model.CompileResult;

import io.opentelemetry.api.trace.Tracer;

/**
 * Contract for compiling break rule source text into a flattened rule data blob.
 */
public interface IRuleCompiler {

    /**
     * Compiles rule source text.
     *
     * <p>Compilation never throws for bad rules; the returned result carries
     * either the blob or a failure status with an optional source location.
     *
     * @param rules the rule source text
     * @return compile result
     */
    CompileResult compile(String rules);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
