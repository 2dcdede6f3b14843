/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.benchmark;

import com.tessera.breakrules.api.model.CompileResult;
import com.tessera.breakrules.compiler.RuleCompiler;
import com.tessera.breakrules.core.BreakRulesFactory;
import com.tessera.breakrules.runtime.BreakRules;
import io.opentelemetry.api.OpenTelemetry;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.ChainedOptionsBuilder;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

import java.util.concurrent.TimeUnit;

/**
 * Rule compilation benchmark.
 * <p>
 * Measures the full compile pipeline, validation of a finished blob and the
 * factory path on rule sets of growing size. Category lookups over a short
 * mixed-script text give a baseline for the runtime trie.
 * <p>
 * USAGE:
 * mvn -pl tessera-benchmarks -am package
 * java -cp tessera-benchmarks/target/classes:... com.tessera.breakrules.benchmark.CompileBenchmark
 * <p>
 * CONFIGURATION:
 * -Dbench.quick : 3 short iterations instead of 10
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Fork(value = 1)
@Warmup(iterations = 5, time = 2)
@Measurement(iterations = 10, time = 2)
public class CompileBenchmark {

    private static final boolean QUICK = Boolean.getBoolean("bench.quick");

    static final String SIMPLE_RULES = "$A = [a-z]; $A $A*;";

    static final String WORD_RULES = String.join("\n",
            "!!chain;",
            "$CR = \\r;",
            "$LF = \\n;",
            "$Newline = [\\p{Word_Break=Newline}];",
            "$Extend = [\\p{Word_Break=Extend}];",
            "$Format = [\\p{Word_Break=Format}];",
            "$Katakana = [\\p{Word_Break=Katakana}];",
            "$ALetter = [\\p{Word_Break=ALetter}];",
            "$MidLetter = [\\p{Word_Break=MidLetter}];",
            "$MidNum = [\\p{Word_Break=MidNum}];",
            "$Numeric = [\\p{Word_Break=Numeric}];",
            "$ExtendNumLet = [\\p{Word_Break=ExtendNumLet}];",
            "$CR $LF;",
            "$ALetter $Extend*;",
            "$ALetter $ALetter {200};",
            "$ALetter ($MidLetter $ALetter)+ {200};",
            "$Numeric ($MidNum $Numeric)* {100};",
            "$Numeric $ALetter {200};",
            "$ALetter $Numeric {200};",
            "$Katakana $Katakana* {400};",
            "($ALetter | $Numeric | $Katakana) $ExtendNumLet {200};",
            "$ExtendNumLet ($ALetter | $Numeric | $Katakana | $ExtendNumLet) {200};",
            "$Format;",
            "$Newline;");

    static final String LINE_RULES = String.join("\n",
            "!!chain;",
            "!!LBCMNoChain;",
            "!!lookAheadHardBreak;",
            "$BK = [\\p{Line_Break=Mandatory_Break}];",
            "$CM = [\\p{Line_Break=Combining_Mark}];",
            "$SP = [\\p{Line_Break=Space}];",
            "$OP = [\\p{Line_Break=Open_Punctuation}];",
            "$CL = [\\p{Line_Break=Close_Punctuation}];",
            "$QU = [\\p{Line_Break=Quotation}];",
            "$AL = [\\p{Line_Break=Alphabetic}];",
            "$ID = [\\p{Line_Break=Ideographic}];",
            "$NU = [\\p{Line_Break=Numeric}];",
            "$PR = [\\p{Line_Break=Prefix_Numeric}];",
            "$PO = [\\p{Line_Break=Postfix_Numeric}];",
            "$IS = [\\p{Line_Break=Infix_Numeric}];",
            "$HY = [\\p{Line_Break=Hyphen}];",
            "$SA = [\\p{Line_Break=Complex_Context}];",
            "$BK {100};",
            "$CM+;",
            "$OP $SP* ($AL | $NU | $ID | $QU);",
            "($AL | $NU) $CM* $CL {200};",
            "$QU $SP* $OP;",
            "$AL $CM* $AL;",
            "$ID $CM* $PO;",
            "($PR | $PO)? ($OP | $HY)? $NU ($NU | $IS)* $CL? ($PR | $PO)? {300};",
            "$AL $HY / $AL;",
            "$SA $SA*;",
            "^$SP+ {400};");

    @Param({"SIMPLE", "WORD", "LINE"})
    private String ruleSet;

    private String rules;
    private byte[] blob;
    private RuleCompiler compiler;
    private BreakRulesFactory factory;
    private int[] sampleText;

    @Setup(Level.Trial)
    public void setupTrial() {
        rules = rulesFor(ruleSet);
        compiler = new RuleCompiler(OpenTelemetry.noop().getTracer("compile-benchmark"));
        factory = new BreakRulesFactory();
        CompileResult result = compiler.compile(rules);
        blob = result.orElseThrow();
        sampleText = "Tessera breaks 12,345 words; жук 中文 ไทย (ok)."
                .codePoints().toArray();
        System.out.printf("[%s] %d bytes, %d categories, %d states, %d safe states%n", ruleSet,
                blob.length, result.stats().categoriesAfterOptimization(),
                result.stats().statesAfterOptimization(), result.stats().safeTableStates());
    }

    static String rulesFor(String ruleSet) {
        switch (ruleSet) {
            case "SIMPLE":
                return SIMPLE_RULES;
            case "WORD":
                return WORD_RULES;
            case "LINE":
                return LINE_RULES;
            default:
                throw new IllegalArgumentException("Unknown rule set: " + ruleSet);
        }
    }

    @Benchmark
    public CompileResult compile() {
        return compiler.compile(rules);
    }

    @Benchmark
    public BreakRules loadBlob() {
        return new BreakRules(blob);
    }

    @Benchmark
    public BreakRules createMatcher() {
        return factory.createMatcher(rules);
    }

    @Benchmark
    @OutputTimeUnit(TimeUnit.NANOSECONDS)
    public void categoryLookup(Blackhole bh, BreakRulesHolder holder) {
        BreakRules breakRules = holder.breakRules;
        for (int codePoint : sampleText) {
            bh.consume(breakRules.categoryOf(codePoint));
        }
    }

    @State(Scope.Benchmark)
    public static class BreakRulesHolder {
        BreakRules breakRules;

        @Setup(Level.Trial)
        public void setup(CompileBenchmark benchmark) {
            breakRules = new BreakRules(benchmark.blob);
        }
    }

    public static void main(String[] args) throws RunnerException {
        ChainedOptionsBuilder jmhBuilder = new OptionsBuilder()
                .include(CompileBenchmark.class.getSimpleName())
                .shouldFailOnError(true);
        if (QUICK) {
            jmhBuilder.warmupIterations(2)
                    .warmupTime(TimeValue.seconds(1))
                    .measurementIterations(3)
                    .measurementTime(TimeValue.seconds(1));
        }
        new Runner(jmhBuilder.build()).run();
    }
}
