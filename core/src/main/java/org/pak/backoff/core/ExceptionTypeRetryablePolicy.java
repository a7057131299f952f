package org.pak.backoff.core;

import lombok.NonNull;
import lombok.ToString;

import java.util.List;

/**
 * Retries exceptions that are instances of any of the given types.
 */
@ToString
public class ExceptionTypeRetryablePolicy implements RetryablePolicy {
    private final List<Class<? extends Exception>> exceptionTypes;

    private ExceptionTypeRetryablePolicy(List<Class<? extends Exception>> exceptionTypes) {
        this.exceptionTypes = exceptionTypes;
    }

    @SafeVarargs
    public static ExceptionTypeRetryablePolicy of(@NonNull Class<? extends Exception>... exceptionTypes) {
        if (exceptionTypes.length == 0) {
            throw new IllegalArgumentException("At least one exception type is required");
        }

        return new ExceptionTypeRetryablePolicy(List.of(exceptionTypes));
    }

    @Override
    public boolean isRetryable(Exception exception) {
        return exceptionTypes.stream().anyMatch(type -> type.isInstance(exception));
    }
}
