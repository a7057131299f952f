package org.pak.backoff.core;

import lombok.NonNull;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Full jitter exponential backoff fitted into a retry window.
 * <p>
 * The n-th wait is sampled uniformly from {@code [0, m * 2^n)} where {@code m} comes from
 * {@link BackoffFormula#calculateExponentialMultiplier(int, double)}. A wait that would end after the deadline is
 * never returned, the call gives up instead.
 */
public class ExponentialBackoffCalculator implements BackoffCalculator {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;
    //longest wait that still converts to nanoseconds for sleeping and scheduling
    static final Duration MAX_WAIT = Duration.ofNanos(Long.MAX_VALUE);

    private final Clock clock;
    private final int maxCallsTotal;
    private final double deadline;
    private final double baseMultiplier;
    private final DoubleSupplier jitter;
    private int attemptsMade = 0;
    private boolean exhausted = false;

    public ExponentialBackoffCalculator(Clock clock, int maxCallsTotal, double windowSeconds) {
        this(clock, maxCallsTotal, windowSeconds, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param jitter source of uniformly distributed values in {@code [0, 1)}
     */
    public ExponentialBackoffCalculator(
            @NonNull Clock clock,
            int maxCallsTotal,
            double windowSeconds,
            @NonNull DoubleSupplier jitter
    ) {
        this.clock = clock;
        this.maxCallsTotal = maxCallsTotal;
        this.deadline = clock.now() + windowSeconds;
        this.baseMultiplier = BackoffFormula.calculateExponentialMultiplier(maxCallsTotal, windowSeconds);
        this.jitter = jitter;
    }

    @Override
    public Optional<Duration> getBackoff() {
        if (exhausted) {
            return Optional.empty();
        }

        var candidate = baseMultiplier * Math.pow(2, attemptsMade);
        var jittered = jitter.getAsDouble() * candidate;
        attemptsMade++;

        if (attemptsMade >= maxCallsTotal) {
            exhausted = true;
            return Optional.empty();
        }

        var secondsLeft = deadline - clock.now();
        // negated so that NaN (0 * infinity after ~1000 attempts) gives up as well
        if (!(jittered <= secondsLeft)) {
            exhausted = true;
            return Optional.empty();
        }

        if (jittered >= MAX_WAIT.getSeconds()) {
            return Optional.of(MAX_WAIT);
        }

        return Optional.of(Duration.ofNanos(Math.round(jittered * NANOS_PER_SECOND)));
    }

    public int getAttemptsMade() {
        return attemptsMade;
    }

    public double getDeadline() {
        return deadline;
    }

    public double getBaseMultiplier() {
        return baseMultiplier;
    }
}
