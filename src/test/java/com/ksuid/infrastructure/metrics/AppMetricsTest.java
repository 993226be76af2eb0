package com.ksuid.infrastructure.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AppMetricsTest {

    private final MeterRegistry registry = new SimpleMeterRegistry();
    private final AppMetrics metrics = new AppMetrics(registry);

    @Test
    void shouldCountGeneratedIds() {
        metrics.incrementGenerated(3);
        metrics.incrementGenerated(2);

        assertEquals(5.0, registry.get("ksuid_generated_total").counter().count());
    }

    @Test
    void shouldCountParseOutcomesSeparately() {
        metrics.incrementParsed();
        metrics.incrementParsed();
        metrics.incrementParseFailures();

        assertEquals(2.0, registry.get("ksuid_parsed_total").counter().count());
        assertEquals(1.0, registry.get("ksuid_parse_failures_total").counter().count());
    }
}
