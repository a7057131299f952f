package org.pak.backoff.core.error;

/**
 * Thrown when an override scope is closed outside of the thread that opened it.
 */
public class OverrideScopeException extends IllegalStateException {
    public OverrideScopeException(String message) {
        super(message);
    }
}
