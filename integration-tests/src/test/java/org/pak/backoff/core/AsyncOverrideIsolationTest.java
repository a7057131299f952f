package org.pak.backoff.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.concurrent.TimeUnit.NANOSECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;

class AsyncOverrideIsolationTest extends BaseIsolationTest {
    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUpScheduler() {
        scheduler = Executors.newScheduledThreadPool(2);
    }

    @AfterEach
    void tearDownScheduler() {
        scheduler.shutdownNow();
    }

    @Override
    protected void callFailingOperation(String key, RetryConfig config, Duration delayBeforeFailure) {
        var result = new AsyncRetryExecutor(config, scheduler).<Void>callAsync(() -> CompletableFuture.supplyAsync(
                () -> failCounting(key),
                CompletableFuture.delayedExecutor(delayBeforeFailure.toNanos(), NANOSECONDS)));

        try {
            result.join();
        } catch (CompletionException e) {
            throw (RuntimeException) e.getCause();
        }
    }

    @Test
    void testRetriesRunWithOverridesOfCaller() throws Exception {
        var seenInAttempts = new AtomicReference<BackoffCalculator>();
        var executor = new AsyncRetryExecutor(config, scheduler);
        CompletableFuture<Void> result;

        try (var ignored = BackoffOverrides.retryImmediately()) {
            result = executor.<Void>callAsync(() -> {
                seenInAttempts.set(BackoffOverrides.resolve(Namespace.DEFAULT)
                        .create(new ManualClock(), MAX_CALLS_TOTAL, 1));
                return CompletableFuture.failedFuture(new TestRetryableException("caller-overrides"));
            });
        }

        try (var ignored = BackoffOverrides.noRetries()) {
            var failed = result.handle((value, error) -> error).get(10, SECONDS);

            assertThat(failed).isInstanceOf(TestRetryableException.class);
            assertThat(seenInAttempts.get()).isInstanceOf(WaitLessBackoffCalculator.class);
        }
    }
}
