package org.pak.backoff.core.error;

import lombok.Getter;
import lombok.NonNull;

import java.time.Duration;

/**
 * Signals that the operation was throttled and names the wait before it may be called again. The retry budget
 * restarts after the wait.
 */
public class RetryAfterException extends RuntimeException {
    @Getter
    private final Duration retryAfter;

    public RetryAfterException(@NonNull Duration retryAfter) {
        this(retryAfter, "Retry after " + retryAfter);
    }

    public RetryAfterException(@NonNull Duration retryAfter, String message) {
        super(message);
        this.retryAfter = requireNotNegative(retryAfter);
    }

    public RetryAfterException(@NonNull Duration retryAfter, String message, Throwable cause) {
        super(message, cause);
        this.retryAfter = requireNotNegative(retryAfter);
    }

    private static Duration requireNotNegative(Duration retryAfter) {
        if (retryAfter.isNegative()) {
            throw new IllegalArgumentException("Retry after must not be negative: " + retryAfter);
        }

        return retryAfter;
    }
}
