package org.pak.backoff.core;

public class TestRetryableException extends RuntimeException {
    public TestRetryableException(String message) {
        super(message);
    }
}
