package org.pak.backoff.core;

@FunctionalInterface
public interface RetryableRunnable<E extends Exception> {
    void run() throws E;
}
