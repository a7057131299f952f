package org.pak.backoff.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Keeps the attempt budget but never waits and ignores the retry window. Useful in tests.
 */
public class WaitLessBackoffCalculator implements BackoffCalculator {
    private final int maxCallsTotal;
    private int attemptsMade = 0;

    public WaitLessBackoffCalculator(Clock clock, int maxCallsTotal, double windowSeconds) {
        this.maxCallsTotal = maxCallsTotal;
    }

    @Override
    public Optional<Duration> getBackoff() {
        if (attemptsMade < maxCallsTotal) {
            attemptsMade++;
        }

        return attemptsMade >= maxCallsTotal ? Optional.empty() : Optional.of(Duration.ZERO);
    }
}
