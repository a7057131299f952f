package org.pak.backoff.core;

import java.time.Duration;
import java.util.Optional;

public class NoRetryBackoffCalculator implements BackoffCalculator {

    public NoRetryBackoffCalculator(Clock clock, int maxCallsTotal, double windowSeconds) {
    }

    @Override
    public Optional<Duration> getBackoff() {
        return Optional.empty();
    }
}
