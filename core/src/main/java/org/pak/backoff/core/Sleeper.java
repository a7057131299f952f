package org.pak.backoff.core;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@FunctionalInterface
interface Sleeper {
    Sleeper THREAD_SLEEP = duration -> {
        if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted before retry wait");
        }

        if (!duration.isZero()) {
            TimeUnit.NANOSECONDS.sleep(duration.toNanos());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
