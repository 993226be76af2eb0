package com.ksuid.application.port.out;

/**
 * Port for recording application metrics.
 * Abstracts the metrics infrastructure from application services.
 */
public interface MetricsPort {

    void incrementGenerated(int count);

    void incrementParsed();

    void incrementParseFailures();
}
