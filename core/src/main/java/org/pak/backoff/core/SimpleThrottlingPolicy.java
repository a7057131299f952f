package org.pak.backoff.core;

import lombok.NonNull;
import org.pak.backoff.core.error.RetryAfterException;

import java.time.Duration;

public class SimpleThrottlingPolicy implements ThrottlingPolicy {

    @Override
    public boolean isThrottled(Exception exception) {
        return exception instanceof RetryAfterException;
    }

    @Override
    @NonNull
    public Duration apply(Exception exception) {
        if (exception instanceof RetryAfterException) {
            return ((RetryAfterException) exception).getRetryAfter();
        }

        return Duration.ZERO;
    }
}
