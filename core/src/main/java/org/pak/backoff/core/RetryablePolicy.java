package org.pak.backoff.core;

@FunctionalInterface
public interface RetryablePolicy {
    boolean isRetryable(Exception exception);
}
