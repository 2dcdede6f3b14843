package com.tessera.breakrules.infra.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.lang.reflect.Method;
import java.time.Duration;
import java.util.Arrays;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsFacadeTest {

    static Stream<Arguments> instruments() {
        return Stream.of(
                Arguments.of(Counter.class, "increment()"),
                Arguments.of(Gauge.class, "set(double)"),
                Arguments.of(Timer.class, "record(Duration)"));
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("instruments")
    @DisplayName("Should expose only the operation break rule creation records")
    void shouldExposeSingleOperation(Class<?> instrument, String signature) {
        assertThat(Arrays.stream(instrument.getDeclaredMethods())
                .filter(method -> !method.isSynthetic())
                .map(MetricsFacadeTest::signature))
                .containsExactly(signature);
    }

    private static String signature(Method method) {
        String parameters = Arrays.stream(method.getParameterTypes())
                .map(type -> type == Duration.class ? "Duration" : type.getName())
                .reduce((a, b) -> a + "," + b)
                .orElse("");
        return method.getName() + "(" + parameters + ")";
    }
}
