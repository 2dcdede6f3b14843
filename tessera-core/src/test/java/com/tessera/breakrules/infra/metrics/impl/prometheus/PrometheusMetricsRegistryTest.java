package com.tessera.breakrules.infra.metrics.impl.prometheus;

import com.tessera.breakrules.infra.metrics.Counter;
import com.tessera.breakrules.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PrometheusMetricsRegistryTest {

    private CollectorRegistry collectors;
    private PrometheusMetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        collectors = new CollectorRegistry();
        metrics = new PrometheusMetricsRegistry(collectors);
    }

    @Test
    @DisplayName("Should export tagged counters as separate label sets of one metric")
    void shouldExportTaggedCounters() {
        metrics.counter("rules_compile_failures_total", "code", "UNCLOSED_SET").increment();
        metrics.counter("rules_compile_failures_total", "code", "RULE_SYNTAX").increment();
        metrics.counter("rules_compile_failures_total", "code", "UNCLOSED_SET").increment();

        assertThat(collectors.getSampleValue("rules_compile_failures_total",
                new String[]{"code"}, new String[]{"UNCLOSED_SET"})).isEqualTo(2.0);
        assertThat(collectors.getSampleValue("rules_compile_failures_total",
                new String[]{"code"}, new String[]{"RULE_SYNTAX"})).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return the same counter for the same series")
    void shouldReuseSeries() {
        Counter first = metrics.counter("rules_compiled_total");
        Counter second = metrics.counter("rules_compiled_total");

        first.increment();

        assertThat(second).isSameAs(first);
        assertThat(collectors.getSampleValue("rules_compiled_total")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should export timers as second-based histograms")
    void shouldExportTimers() {
        Timer timer = metrics.timer("rules_compile_latency");

        timer.record(Duration.ofMillis(150));
        timer.record(Duration.ofMillis(50));

        assertThat(collectors.getSampleValue("rules_compile_latency_seconds_count")).isEqualTo(2.0);
        assertThat(collectors.getSampleValue("rules_compile_latency_seconds_sum"))
                .isCloseTo(0.2, org.assertj.core.data.Offset.offset(1e-9));
        assertThat(collectors.getSampleValue("rules_compile_latency_seconds_bucket",
                new String[]{"le"}, new String[]{"0.1"})).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should export gauges")
    void shouldExportGauges() {
        metrics.gauge("rules_data_bytes").set(568);

        metrics.gauge("rules_data_bytes").set(600);

        assertThat(collectors.getSampleValue("rules_data_bytes")).isEqualTo(600.0);
    }

    @Test
    @DisplayName("Should sanitize metric names")
    void shouldSanitizeNames() {
        assertThat(PrometheusMetricsRegistry.sanitizeName("Rules.Compile--Latency")).isEqualTo("rules_compile_latency");
    }
}
