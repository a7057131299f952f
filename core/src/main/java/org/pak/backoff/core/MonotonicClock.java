package org.pak.backoff.core;

public class MonotonicClock implements Clock {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    @Override
    public double now() {
        return System.nanoTime() / NANOS_PER_SECOND;
    }
}
