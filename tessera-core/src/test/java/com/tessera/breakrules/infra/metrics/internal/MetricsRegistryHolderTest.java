package com.tessera.breakrules.infra.metrics.internal;

import com.tessera.breakrules.infra.metrics.MetricsRegistry;
import com.tessera.breakrules.infra.metrics.api.MetricsRegistryProvider;
import com.tessera.breakrules.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.tessera.breakrules.infra.metrics.impl.inmemory.InMemoryMetricsRegistryProvider;
import com.tessera.breakrules.infra.metrics.impl.prometheus.PrometheusMetricsRegistry;
import com.tessera.breakrules.infra.metrics.impl.prometheus.PrometheusMetricsRegistryProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class MetricsRegistryHolderTest {

    @Test
    @DisplayName("Should fall back to a no-op registry without providers")
    void shouldFallBackToNoOp() {
        MetricsRegistry registry = MetricsRegistryHolder.select(List.of());

        assertThat(registry).isSameAs(NoOpMetricsRegistry.INSTANCE);
        assertThat(registry.counter("a")).isSameAs(registry.counter("b", "code", "X"));
        assertThatCode(() -> {
            registry.counter("anything").increment();
            registry.gauge("bytes").set(1);
            registry.timer("latency").record(Duration.ofMillis(1));
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should pick the provider with the highest priority")
    void shouldPickHighestPriority() {
        List<MetricsRegistryProvider> providers =
                List.of(new PrometheusMetricsRegistryProvider(), new InMemoryMetricsRegistryProvider());

        assertThat(MetricsRegistryHolder.select(providers)).isInstanceOf(InMemoryMetricsRegistry.class);
    }

    @Test
    @DisplayName("Should discover the test provider through the service loader")
    void shouldDiscoverTestProvider() {
        assertThat(MetricsRegistry.getInstance())
                .isInstanceOf(InMemoryMetricsRegistry.class)
                .isNotInstanceOf(PrometheusMetricsRegistry.class);
    }
}
