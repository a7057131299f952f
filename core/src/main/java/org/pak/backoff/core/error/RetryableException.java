package org.pak.backoff.core.error;

/**
 * Marks a failure as worth retrying without tying it to a specific exception type. Recognized by
 * {@link org.pak.backoff.core.SimpleRetryablePolicy}.
 */
public class RetryableException extends RuntimeException {

    public RetryableException(String message) {
        super(message);
    }

    public RetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
