package org.pak.backoff.core;

import org.pak.backoff.core.error.RetryableException;

public class SimpleRetryablePolicy implements RetryablePolicy {

    @Override
    public boolean isRetryable(Exception exception) {
        return exception instanceof RetryableException;
    }
}
