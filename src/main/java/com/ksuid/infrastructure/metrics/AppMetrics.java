package com.ksuid.infrastructure.metrics;

import com.ksuid.application.port.out.MetricsPort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class AppMetrics implements MetricsPort {

    private final Counter generated;
    private final Counter parsed;
    private final Counter parseFailures;

    public AppMetrics(MeterRegistry registry) {
        this.generated = Counter.builder("ksuid_generated_total")
            .description("Total number of KSUIDs generated")
            .register(registry);

        this.parsed = Counter.builder("ksuid_parsed_total")
            .description("Total number of KSUIDs parsed successfully")
            .register(registry);

        this.parseFailures = Counter.builder("ksuid_parse_failures_total")
            .description("Total number of strings rejected as KSUIDs")
            .register(registry);
    }

    @Override
    public void incrementGenerated(int count) {
        generated.increment(count);
    }

    @Override
    public void incrementParsed() {
        parsed.increment();
    }

    @Override
    public void incrementParseFailures() {
        parseFailures.increment();
    }
}
