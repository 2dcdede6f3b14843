/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler;

import com.tessera.breakrules.api.CompilationListener;
import com.tessera.breakrules.api.exceptions.RuleCompilationException;
import com.tessera.breakrules.api.exceptions.RuleSyntaxException;
import com.tessera.breakrules.api.model.CompileResult;
import com.tessera.breakrules.api.model.CompileStats;
import com.tessera.breakrules.api.model.CompileStatus;
import com.tessera.breakrules.api.model.RuleErrorCode;
import com.tessera.breakrules.compiler.CompilerConfig.DebugTopic;
import com.tessera.breakrules.compiler.flatten.RuleDataFlattener;
import com.tessera.breakrules.compiler.parse.ParsedRules;
import com.tessera.breakrules.compiler.parse.RuleScanner;
import com.tessera.breakrules.compiler.sets.CategoryBuilder;
import com.tessera.breakrules.compiler.table.MinimizationReport;
import com.tessera.breakrules.compiler.table.TableBuilder;
import com.tessera.breakrules.compiler.table.TableMinimizer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Runs one compilation from rule text to rule data blob.
 *
 * <p>A builder is used for exactly one {@link #build()} and then closed. It
 * owns every intermediate structure; collaborators are created lazily by the
 * parsing stage, so a builder handed a failed status allocates nothing.
 * Stages run in {@link BuildStage} order and the first failure stops the
 * pipeline: no later stage runs and no blob is produced.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (RuleBuilder builder = new RuleBuilder(rules, CompileStatus.ok(), config, tracer, null)) {
 *     CompileResult result = builder.build();
 * }
 * }</pre>
 */
public final class RuleBuilder implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(RuleBuilder.class.getName());

    private final CompilerConfig config;
    private final Tracer tracer;
    private final CompilationListener listener;

    private String rules;
    private String strippedRules;
    private CompileStatus status;
    private boolean built;

    private RuleScanner scanner;
    private ParsedRules parsed;
    private CategoryBuilder categories;
    private TableBuilder tables;
    private MinimizationReport minimization;
    private byte[] data;

    private int categoriesBefore;
    private int statesBefore;

    public RuleBuilder(String rules, CompileStatus incoming, CompilerConfig config, Tracer tracer,
                       CompilationListener listener) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.status = Objects.requireNonNull(incoming, "incoming");
        this.config = Objects.requireNonNull(config, "config");
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.listener = listener;
    }

    /**
     * Runs every stage.
     *
     * @return the blob, or the first failure with statistics gathered so far
     * @throws IllegalStateException if called twice or after {@link #close()}
     */
    public CompileResult build() {
        if (built) {
            throw new IllegalStateException("RuleBuilder already used");
        }
        built = true;
        long start = System.nanoTime();

        runStage(BuildStage.PARSING, this::parse);
        runStage(BuildStage.CATEGORY_BUILDING, this::buildCategories);
        runStage(BuildStage.FORWARD_TABLE, this::buildForwardTable);
        runStage(BuildStage.TABLE_OPTIMIZATION, this::optimizeTables);
        runStage(BuildStage.SAFE_REVERSE_TABLE, this::buildSafeReverseTable);
        runStage(BuildStage.TRIE_BUILDING, this::buildTrie);
        runStage(BuildStage.FLATTENING, this::flatten);

        CompileStats stats = collectStats().withDuration(System.nanoTime() - start);
        if (status.isFailure()) {
            return CompileResult.failure(status, stats);
        }
        return CompileResult.success(data, stats);
    }

    public CompileStatus status() {
        return status;
    }

    private Map<String, Object> parse() {
        scanner = new RuleScanner(rules);
        parsed = scanner.parse();
        categories = new CategoryBuilder(parsed.setLeaves());

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("ruleCount", parsed.ruleCount());
        metrics.put("variableCount", parsed.variableCount());
        metrics.put("setCount", parsed.setLeaves().size());
        metrics.put("statusTagCount", parsed.statusValues().size());
        return metrics;
    }

    private Map<String, Object> buildCategories() {
        categories.buildRanges();
        categoriesBefore = categories.getNumCharCategories();
        dump(DebugTopic.RANGES, categories::describeRanges);
        return Map.of("categoryCount", categoriesBefore);
    }

    private Map<String, Object> buildForwardTable() {
        tables = new TableBuilder(parsed, categories, config.maxStates());
        tables.buildForwardTable();
        statesBefore = tables.stateCount();
        return Map.of("stateCount", statesBefore);
    }

    private Map<String, Object> optimizeTables() {
        minimization = new TableMinimizer(tables, categories).minimize();
        dump(DebugTopic.STATES, tables::describeStates);
        dump(DebugTopic.STATUS, tables::describeStatusTable);

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("passes", minimization.passes());
        metrics.put("columnsMerged", minimization.columnsMerged());
        metrics.put("statesMerged", minimization.statesMerged());
        metrics.put("categoryCount", categories.getNumCharCategories());
        metrics.put("stateCount", tables.stateCount());
        return metrics;
    }

    private Map<String, Object> buildSafeReverseTable() {
        tables.buildSafeReverseTable();
        dump(DebugTopic.SAFE, tables::describeSafeTable);
        return Map.of("safeStateCount", tables.safeStateCount());
    }

    private Map<String, Object> buildTrie() {
        categories.buildTrie();
        return Map.of("trieBytes", categories.getTrieSize());
    }

    private Map<String, Object> flatten() {
        strippedRules = RuleScanner.stripRules(rules);
        data = new RuleDataFlattener(tables, categories, parsed.statusValues(), strippedRules).flatten();
        return Map.of("dataLength", data.length, "sourceChars", strippedRules.length());
    }

    private void runStage(BuildStage stage, Supplier<Map<String, Object>> work) {
        if (status.isFailure()) {
            return;
        }
        String stageName = stage.name();
        if (listener != null) {
            listener.onStageStart(stageName, stage.number(), BuildStage.values().length);
        }
        Span span = tracer.spanBuilder(stage.spanName()).startSpan();
        long start = System.nanoTime();
        try (Scope scope = span.makeCurrent()) {
            Map<String, Object> metrics = work.get();
            long duration = System.nanoTime() - start;
            metrics.forEach((key, value) -> {
                if (value instanceof Number number) {
                    span.setAttribute(key, number.longValue());
                }
            });
            logger.fine(() -> String.format("%s completed in %d us: %s", stageName, duration / 1_000, metrics));
            if (listener != null) {
                listener.onStageComplete(stageName, new CompilationListener.StageResult(stageName, duration, metrics));
            }
        } catch (RuleSyntaxException e) {
            fail(stage, span, e, CompileStatus.failure(e.getErrorCode(), e.getReason(), e.getLocation()));
        } catch (RuleCompilationException e) {
            fail(stage, span, e, CompileStatus.failure(e.getErrorCode(), e.getMessage()));
        } catch (OutOfMemoryError e) {
            RuleCompilationException wrapped = new RuleCompilationException(
                    RuleErrorCode.MEMORY_ALLOCATION_ERROR, "Out of memory in " + stageName, e);
            fail(stage, span, wrapped, CompileStatus.failure(RuleErrorCode.MEMORY_ALLOCATION_ERROR, wrapped.getMessage()));
        } catch (RuntimeException e) {
            fail(stage, span, e, CompileStatus.failure(RuleErrorCode.INTERNAL_ERROR,
                    stageName + " failed: " + e));
        } finally {
            span.end();
        }
    }

    private void fail(BuildStage stage, Span span, Exception error, CompileStatus failure) {
        status = failure;
        span.recordException(error);
        span.setStatus(StatusCode.ERROR, failure.errorCode().name());
        logger.warning("Rule compilation failed in " + stage + ": " + failure);
        if (listener != null) {
            listener.onError(stage.name(), error);
        }
    }

    private void dump(DebugTopic topic, Supplier<String> description) {
        if (config.isDebugEnabled(topic)) {
            logger.info(description.get());
        }
    }

    private CompileStats collectStats() {
        int categoriesAfter = categories == null ? 0 : categories.getNumCharCategories();
        return new CompileStats(
                categoriesBefore,
                categoriesAfter,
                statesBefore,
                tables == null ? 0 : tables.stateCount(),
                minimization == null ? 0 : minimization.passes(),
                tables == null ? 0 : tables.safeStateCount(),
                parsed == null ? 0 : parsed.statusValues().size(),
                data == null ? 0 : data.length,
                0L);
    }

    /**
     * True while any intermediate structure is held.
     */
    boolean hasAllocatedState() {
        return scanner != null || parsed != null || categories != null || tables != null
                || minimization != null || strippedRules != null;
    }

    /**
     * Releases every intermediate structure. The blob returned by
     * {@link #build()} stays valid; it belongs to the caller.
     */
    @Override
    public void close() {
        scanner = null;
        parsed = null;
        categories = null;
        tables = null;
        minimization = null;
        strippedRules = null;
        rules = null;
        data = null;
        built = true;
    }
}
