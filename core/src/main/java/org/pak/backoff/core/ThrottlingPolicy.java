package org.pak.backoff.core;

import lombok.NonNull;

import java.time.Duration;

/**
 * Recognizes failures that demand a fixed wait before the next attempt. Such a failure restarts the retry budget
 * instead of consuming it.
 */
public interface ThrottlingPolicy {
    boolean isThrottled(Exception exception);

    @NonNull
    Duration apply(Exception exception);
}
