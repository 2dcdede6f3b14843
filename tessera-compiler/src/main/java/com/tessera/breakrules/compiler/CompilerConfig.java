/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler;

import com.tessera.breakrules.runtime.model.RuleDataFormat;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Configuration for the rule compiler.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code BREAKRULES_DEBUG} - comma-separated dump topics:
 *       {@code states}, {@code safe}, {@code status}, {@code ranges}</li>
 *   <li>{@code BREAKRULES_MAX_STATES} - upper bound on forward table states (at most 65535)</li>
 * </ul>
 *
 * <p>Environment variables are applied when the builder is created; explicit
 * builder calls override them.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CompilerConfig config = CompilerConfig.builder()
 *     .debug(DebugTopic.STATES)
 *     .maxStates(4096)
 *     .build();
 * }</pre>
 */
public final class CompilerConfig {

    private static final Logger logger = Logger.getLogger(CompilerConfig.class.getName());

    private static final String ENV_DEBUG = "BREAKRULES_DEBUG";
    private static final String ENV_MAX_STATES = "BREAKRULES_MAX_STATES";

    /**
     * Debug dumps written to the log after the corresponding stage.
     */
    public enum DebugTopic {
        /** Forward state table. */
        STATES,
        /** Safe reverse table. */
        SAFE,
        /** Rule status table. */
        STATUS,
        /** Code point ranges and their categories. */
        RANGES
    }

    private final Set<DebugTopic> debugTopics;
    private final int maxStates;

    private CompilerConfig(Builder builder) {
        this.debugTopics = Collections.unmodifiableSet(EnumSet.copyOf(builder.debugTopics));
        this.maxStates = builder.maxStates;
        validate();
    }

    public static CompilerConfig defaults() {
        return builder().build();
    }

    /**
     * Creates a builder preloaded from the process environment.
     */
    public static Builder builder() {
        return new Builder(System::getenv);
    }

    /**
     * Creates a builder preloaded from the given variable lookup.
     */
    static Builder builder(UnaryOperator<String> environment) {
        return new Builder(environment);
    }

    public boolean isDebugEnabled(DebugTopic topic) {
        return debugTopics.contains(topic);
    }

    public Set<DebugTopic> debugTopics() {
        return debugTopics;
    }

    public int maxStates() {
        return maxStates;
    }

    private void validate() {
        if (maxStates < 2 || maxStates > RuleDataFormat.MAX_STATES) {
            throw new IllegalArgumentException("maxStates must be between 2 and "
                    + RuleDataFormat.MAX_STATES + ": " + maxStates);
        }
    }

    @Override
    public String toString() {
        return "CompilerConfig{debugTopics=" + debugTopics + ", maxStates=" + maxStates + "}";
    }

    public static final class Builder {

        private final EnumSet<DebugTopic> debugTopics = EnumSet.noneOf(DebugTopic.class);
        private int maxStates = RuleDataFormat.MAX_STATES;

        private Builder(UnaryOperator<String> environment) {
            applyEnvironmentVariables(environment);
        }

        private void applyEnvironmentVariables(UnaryOperator<String> environment) {
            getEnv(environment, ENV_DEBUG).ifPresent(val -> {
                for (String token : val.split(",")) {
                    String topic = token.trim().toUpperCase(Locale.ROOT);
                    if (topic.isEmpty()) {
                        continue;
                    }
                    try {
                        debugTopics.add(DebugTopic.valueOf(topic));
                    } catch (IllegalArgumentException e) {
                        logger.warning("Ignoring unknown " + ENV_DEBUG + " topic: " + token.trim());
                    }
                }
            });
            getEnv(environment, ENV_MAX_STATES).ifPresent(val -> {
                try {
                    this.maxStates = Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + ENV_MAX_STATES + ": " + val);
                }
            });
        }

        public Builder debug(DebugTopic... topics) {
            Collections.addAll(debugTopics, topics);
            return this;
        }

        public Builder noDebug() {
            debugTopics.clear();
            return this;
        }

        public Builder maxStates(int maxStates) {
            this.maxStates = maxStates;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(this);
        }

        private static Optional<String> getEnv(UnaryOperator<String> environment, String key) {
            String value = environment.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded env var: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }
    }
}
