package org.pak.backoff.core;

@FunctionalInterface
public interface RetryableOperation<T, E extends Exception> {
    T call() throws E;
}
