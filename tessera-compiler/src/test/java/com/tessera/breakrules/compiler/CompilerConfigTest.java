package com.tessera.breakrules.compiler;

import com.tessera.breakrules.compiler.CompilerConfig.DebugTopic;
import com.tessera.breakrules.runtime.model.RuleDataFormat;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompilerConfigTest {

    @Test
    @DisplayName("Should default to no debug output and the format's state limit")
    void shouldUseDefaults() {
        CompilerConfig config = CompilerConfig.builder(Map.<String, String>of()::get).build();

        assertThat(config.debugTopics()).isEmpty();
        assertThat(config.maxStates()).isEqualTo(RuleDataFormat.MAX_STATES);
    }

    @Test
    @DisplayName("Should read debug topics from the environment, ignoring unknown ones")
    void shouldReadDebugTopics() {
        Map<String, String> env = Map.of("BREAKRULES_DEBUG", " states, ranges ,bogus,");

        CompilerConfig config = CompilerConfig.builder(env::get).build();

        assertThat(config.debugTopics()).containsExactlyInAnyOrder(DebugTopic.STATES, DebugTopic.RANGES);
        assertThat(config.isDebugEnabled(DebugTopic.SAFE)).isFalse();
    }

    @Test
    @DisplayName("Should read the state limit and ignore a malformed value")
    void shouldReadMaxStates() {
        assertThat(CompilerConfig.builder(Map.of("BREAKRULES_MAX_STATES", "500")::get).build().maxStates())
                .isEqualTo(500);
        assertThat(CompilerConfig.builder(Map.of("BREAKRULES_MAX_STATES", "lots")::get).build().maxStates())
                .isEqualTo(RuleDataFormat.MAX_STATES);
    }

    @Test
    @DisplayName("Should let explicit settings override the environment")
    void shouldOverrideEnvironment() {
        Map<String, String> env = Map.of("BREAKRULES_DEBUG", "safe", "BREAKRULES_MAX_STATES", "100");

        CompilerConfig config = CompilerConfig.builder(env::get)
                .noDebug()
                .debug(DebugTopic.STATUS)
                .maxStates(40)
                .build();

        assertThat(config.debugTopics()).containsExactly(DebugTopic.STATUS);
        assertThat(config.maxStates()).isEqualTo(40);
    }

    @Test
    @DisplayName("Should reject a state limit outside the table format")
    void shouldRejectBadLimit() {
        assertThatThrownBy(() -> CompilerConfig.builder().maxStates(1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CompilerConfig.builder().maxStates(RuleDataFormat.MAX_STATES + 1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
