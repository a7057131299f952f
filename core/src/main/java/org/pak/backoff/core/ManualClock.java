package org.pak.backoff.core;

/**
 * Clock that only moves when told to. Meant for tests.
 */
public class ManualClock implements Clock {
    private volatile double time;

    public ManualClock() {
        this(0.0);
    }

    public ManualClock(double time) {
        this.time = time;
    }

    public synchronized void advanceTo(double t) {
        if (t < time) {
            throw new IllegalArgumentException("Clock should not go backwards, current " + time + ", requested " + t);
        }

        time = t;
    }

    public synchronized void advanceBy(double seconds) {
        advanceTo(time + seconds);
    }

    @Override
    public double now() {
        return time;
    }
}
