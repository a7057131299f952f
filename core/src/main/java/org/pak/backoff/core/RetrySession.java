package org.pak.backoff.core;

import com.google.common.base.Throwables;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Attempt bookkeeping of one logical call, shared by the blocking and the non blocking executor.
 * <p>
 * Attempts never overlap, so the session is not synchronized. {@link #getLastFailure()} may be read from any thread.
 */
@Slf4j
class RetrySession {
    private final RetryConfig config;
    private final BackoffCalculatorFactory factory;
    private final Clock clock;
    private BackoffCalculator calculator;
    private int attempt = 0;
    private volatile Exception lastFailure;

    RetrySession(RetryConfig config, BackoffCalculatorFactory factory, Clock clock) {
        this.config = config;
        this.factory = factory;
        this.clock = clock;
    }

    void beforeAttempt() {
        // the window starts at the first attempt, or at the first attempt after a throttle signal
        if (calculator == null) {
            calculator = factory.create(clock, config.getMaxCallsTotal(), config.getRetryWindowSeconds());
        }

        attempt++;
    }

    /**
     * @return the wait before the next attempt, or empty when {@link #getLastFailure()} has to be surfaced
     */
    Optional<Duration> onFailure(Exception failure) {
        var throttlingPolicy = config.getThrottlingPolicy();

        if (throttlingPolicy.isThrottled(failure)) {
            link(failure);
            var pause = throttlingPolicy.apply(failure);
            calculator = null;

            log.info("Throttled on attempt {}, retry budget restarts after {}", attempt, pause);
            return Optional.of(pause);
        }

        if (!config.getRetryablePolicy().isRetryable(failure)) {
            lastFailure = failure;

            log.debug("Non retryable exception occurred on attempt {}", attempt);
            return Optional.empty();
        }

        link(failure);
        log.info("Retryable exception occurred, attempt {}: {}", attempt, failure.toString());

        var backoff = calculator.getBackoff();
        if (backoff.isEmpty()) {
            log.debug("No point retrying after attempt {}, out of calls or next attempt would be after deadline",
                    attempt);
        }

        return backoff;
    }

    int getAttempt() {
        return attempt;
    }

    Exception getLastFailure() {
        return lastFailure;
    }

    private void link(Exception failure) {
        var previous = lastFailure;
        lastFailure = failure;

        if (previous == null || previous == failure
                || Throwables.getCausalChain(previous).contains(failure)
                || Throwables.getCausalChain(failure).contains(previous)) {
            return;
        }

        if (failure.getCause() == null) {
            try {
                failure.initCause(previous);
                return;
            } catch (IllegalStateException e) {
                // cause was explicitly set to null in the constructor
                log.trace("Cause of {} cannot be set, previous failure goes to suppressed", failure.getClass());
            }
        }

        failure.addSuppressed(previous);
    }
}
