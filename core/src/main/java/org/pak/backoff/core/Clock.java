package org.pak.backoff.core;

/**
 * Source of time for backoff decisions, in seconds since an arbitrary monotonic origin.
 */
public interface Clock {
    double now();
}
