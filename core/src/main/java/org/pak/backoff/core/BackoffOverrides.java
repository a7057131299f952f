package org.pak.backoff.core;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Registry deciding which {@link BackoffCalculator} a call site gets, per {@link Namespace}.
 * <p>
 * Every namespace starts out with {@link ExponentialBackoffCalculator}. Overrides installed with
 * {@link #replace(Namespace, BackoffCalculatorFactory)} are visible only to the current thread, until the returned
 * scope is closed:
 * <pre>{@code
 * try (var ignored = BackoffOverrides.retryImmediately()) {
 *     client.fetch();
 * }
 * }</pre>
 * Work handed to other threads sees the overrides only when it is wrapped with {@link #wrap(Runnable)} or submitted
 * through {@link #contextExecutor(Executor)}; it then gets a copy taken at submission time, so later changes on
 * either side stay invisible to the other.
 */
@Slf4j
public final class BackoffOverrides {
    private static final Map<Namespace, BackoffCalculatorFactory> DEFAULT_FACTORIES = new ConcurrentHashMap<>();
    private static final ThreadLocal<Map<Namespace, BackoffCalculatorFactory>> CONTEXT_OVERRIDES =
            ThreadLocal.withInitial(Map::of);

    private BackoffOverrides() {
    }

    public static OverrideScope replace(@NonNull Namespace namespace, @NonNull BackoffCalculatorFactory factory) {
        var previous = current();
        var overrides = new HashMap<>(previous);
        overrides.put(namespace, factory);
        install(Map.copyOf(overrides));

        log.debug("Backoff for namespace {} replaced in thread {}", namespace, Thread.currentThread().getName());
        return new OverrideScope(namespace, previous.get(namespace));
    }

    public static OverrideScope replace(@NonNull BackoffCalculatorFactory factory) {
        return replace(Namespace.DEFAULT, factory);
    }

    /**
     * Keeps retrying up to the configured number of calls, without waiting in between.
     */
    public static OverrideScope retryImmediately(@NonNull Namespace namespace) {
        return replace(namespace, WaitLessBackoffCalculator::new);
    }

    public static OverrideScope retryImmediately() {
        return retryImmediately(Namespace.DEFAULT);
    }

    /**
     * Makes every call exactly once.
     */
    public static OverrideScope noRetries(@NonNull Namespace namespace) {
        return replace(namespace, NoRetryBackoffCalculator::new);
    }

    public static OverrideScope noRetries() {
        return noRetries(Namespace.DEFAULT);
    }

    public static BackoffCalculatorFactory resolve(@NonNull Namespace namespace) {
        return capture().resolve(namespace);
    }

    public static OverrideSnapshot capture() {
        return new OverrideSnapshot(current());
    }

    public static Runnable wrap(@NonNull Runnable runnable) {
        return capture().wrap(runnable);
    }

    public static <T> Callable<T> wrap(@NonNull Callable<T> callable) {
        return capture().wrap(callable);
    }

    public static Executor contextExecutor(@NonNull Executor executor) {
        return command -> executor.execute(wrap(command));
    }

    static BackoffCalculatorFactory defaultFactory(Namespace namespace) {
        return DEFAULT_FACTORIES.computeIfAbsent(namespace, n -> ExponentialBackoffCalculator::new);
    }

    static Map<Namespace, BackoffCalculatorFactory> current() {
        return CONTEXT_OVERRIDES.get();
    }

    static void install(Map<Namespace, BackoffCalculatorFactory> overrides) {
        if (overrides.isEmpty()) {
            CONTEXT_OVERRIDES.remove();
        } else {
            CONTEXT_OVERRIDES.set(overrides);
        }
    }
}
