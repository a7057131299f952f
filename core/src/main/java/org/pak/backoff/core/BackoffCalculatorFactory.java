package org.pak.backoff.core;

@FunctionalInterface
public interface BackoffCalculatorFactory {
    BackoffCalculator create(Clock clock, int maxCallsTotal, double windowSeconds);
}
