package org.pak.backoff.core;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Non blocking counterpart of {@link RetryExecutor}. Waits between attempts are scheduled instead of slept, so no
 * thread is held while waiting.
 * <p>
 * The overrides of the calling thread are captured when {@link #callAsync(Supplier)} is invoked; every attempt of
 * that call runs with them installed, whatever thread it runs on.
 * <p>
 * Cancelling the returned future cancels the pending wait and the operation is not called again. The future then
 * fails with a {@link CancellationException} caused by the last failure.
 */
@Slf4j
public class AsyncRetryExecutor implements AutoCloseable {
    private final RetryConfig config;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Clock clock;

    public AsyncRetryExecutor(@NonNull RetryConfig config) {
        this(config, Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("backoff-" + config.getNamespace() + "-scheduler-%d")
                .setDaemon(true)
                .setUncaughtExceptionHandler((t, e) -> log.error("Uncaught exception in thread {}", t.getName(), e))
                .build()), true, new MonotonicClock());
    }

    public AsyncRetryExecutor(@NonNull RetryConfig config, @NonNull ScheduledExecutorService scheduler) {
        this(config, scheduler, false, new MonotonicClock());
    }

    AsyncRetryExecutor(
            @NonNull RetryConfig config,
            @NonNull ScheduledExecutorService scheduler,
            boolean ownsScheduler,
            @NonNull Clock clock
    ) {
        this.config = config;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.clock = clock;
    }

    public <T> CompletableFuture<T> callAsync(@NonNull Supplier<? extends CompletionStage<T>> operation) {
        var snapshot = BackoffOverrides.capture();
        var session = new RetrySession(config, snapshot.resolve(config.getNamespace()), clock);
        var result = new RetryFuture<T>(session);

        attempt(operation, snapshot, session, result);
        return result;
    }

    private <T> void attempt(
            Supplier<? extends CompletionStage<T>> operation,
            OverrideSnapshot snapshot,
            RetrySession session,
            RetryFuture<T> result
    ) {
        if (result.isDone()) {
            return;
        }

        // runs on the scheduler for retries, where anything thrown would be lost in the scheduled future
        try {
            session.beforeAttempt();

            var stage = start(operation, snapshot);
            stage.whenComplete((value, error) -> {
                if (error == null) {
                    result.complete(value);
                } else {
                    handleFailure(unwrap(error), operation, snapshot, session, result);
                }
            });
        } catch (Throwable e) {
            log.error("Attempt {} failed before completing", session.getAttempt(), e);
            result.completeExceptionally(e);
        }
    }

    private static <T> CompletionStage<T> start(
            Supplier<? extends CompletionStage<T>> operation,
            OverrideSnapshot snapshot
    ) {
        try {
            var stage = snapshot.supply(operation);
            if (stage == null) {
                return CompletableFuture.failedFuture(new NullPointerException("Operation returned null stage"));
            }
            return stage;
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T> void handleFailure(
            Throwable error,
            Supplier<? extends CompletionStage<T>> operation,
            OverrideSnapshot snapshot,
            RetrySession session,
            RetryFuture<T> result
    ) {
        if (!(error instanceof Exception)) {
            result.completeExceptionally(error);
            return;
        }

        try {
            var backoff = session.onFailure((Exception) error);

            if (backoff.isEmpty()) {
                result.completeExceptionally(session.getLastFailure());
            } else {
                log.debug("Waiting {} after attempt {}", backoff.get(), session.getAttempt());
                result.schedule(() -> attempt(operation, snapshot, session, result), backoff.get());
            }
        } catch (RuntimeException | Error e) {
            log.error("Retry could not be scheduled after attempt {}", session.getAttempt(), e);
            if (e != error) {
                e.addSuppressed(error);
            }
            result.completeExceptionally(e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        var current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }

        return current;
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdown();
            log.info("Retry scheduler for namespace {} is shut down", config.getNamespace());
        }
    }

    private class RetryFuture<T> extends CompletableFuture<T> {
        private final RetrySession session;
        private volatile Future<?> pending;

        RetryFuture(RetrySession session) {
            this.session = session;
        }

        void schedule(Runnable nextAttempt, Duration delay) {
            var scheduled = scheduler.schedule(nextAttempt, delay.toNanos(), NANOSECONDS);
            pending = scheduled;

            if (isDone()) {
                scheduled.cancel(false);
            }
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            var cancellation = new CancellationException("Retry cancelled after attempt " + session.getAttempt());
            var lastFailure = session.getLastFailure();
            if (lastFailure != null) {
                cancellation.initCause(lastFailure);
            }

            var cancelled = completeExceptionally(cancellation);

            var scheduled = pending;
            if (scheduled != null) {
                scheduled.cancel(false);
            }

            return cancelled || isCancelled();
        }
    }
}
