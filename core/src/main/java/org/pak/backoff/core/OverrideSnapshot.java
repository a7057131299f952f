package org.pak.backoff.core;

import lombok.NonNull;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Immutable copy of the overrides of one thread, used to carry them into work running elsewhere.
 */
public final class OverrideSnapshot {
    private final Map<Namespace, BackoffCalculatorFactory> overrides;

    OverrideSnapshot(Map<Namespace, BackoffCalculatorFactory> overrides) {
        this.overrides = overrides;
    }

    public BackoffCalculatorFactory resolve(@NonNull Namespace namespace) {
        var factory = overrides.get(namespace);

        return factory != null ? factory : BackoffOverrides.defaultFactory(namespace);
    }

    public <T> T call(@NonNull Callable<T> callable) throws Exception {
        var previous = BackoffOverrides.current();
        BackoffOverrides.install(overrides);
        try {
            return callable.call();
        } finally {
            BackoffOverrides.install(previous);
        }
    }

    public <T> T supply(@NonNull Supplier<T> supplier) {
        var previous = BackoffOverrides.current();
        BackoffOverrides.install(overrides);
        try {
            return supplier.get();
        } finally {
            BackoffOverrides.install(previous);
        }
    }

    public void run(@NonNull Runnable runnable) {
        supply(() -> {
            runnable.run();
            return null;
        });
    }

    public Runnable wrap(@NonNull Runnable runnable) {
        return () -> run(runnable);
    }

    public <T> Callable<T> wrap(@NonNull Callable<T> callable) {
        return () -> call(callable);
    }
}
