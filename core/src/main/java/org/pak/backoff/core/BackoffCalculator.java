package org.pak.backoff.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides, after each failed attempt of one logical call, whether to wait and for how long.
 * <p>
 * An instance belongs to a single logical call and is never shared. Once {@link #getBackoff()} returned an empty
 * result, every later call on the same instance returns empty as well.
 */
public interface BackoffCalculator {

    /**
     * Called exactly once per failed attempt.
     *
     * @return the wait before the next attempt, or empty when no further attempt should be made
     */
    Optional<Duration> getBackoff();
}
