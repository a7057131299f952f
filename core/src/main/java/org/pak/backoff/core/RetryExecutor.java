package org.pak.backoff.core;

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;

/**
 * Calls an operation on the current thread until it succeeds, fails with a non retryable exception or runs out of
 * calls or time, sleeping between attempts.
 * <pre>{@code
 * var executor = new RetryExecutor(RetryConfig.builder()
 *         .maxCallsTotal(5)
 *         .retryWindow(Duration.ofMinutes(2))
 *         .retryablePolicy(ExceptionTypeRetryablePolicy.of(IOException.class))
 *         .build());
 *
 * var body = executor.call(() -> client.fetch(uri));
 * }</pre>
 * The exception thrown once retrying stops is the one of the last attempt, with the failures of the earlier attempts
 * reachable through its cause chain. When the thread is interrupted while waiting, the interrupt flag is restored and
 * the last failure is thrown right away.
 */
@Slf4j
public class RetryExecutor {
    public static final String NAMESPACE_MDC_KEY = "retryNamespace";

    private final RetryConfig config;
    private final Clock clock;
    private final Sleeper sleeper;

    public RetryExecutor(@NonNull RetryConfig config) {
        this(config, new MonotonicClock(), Sleeper.THREAD_SLEEP);
    }

    RetryExecutor(@NonNull RetryConfig config, @NonNull Clock clock, @NonNull Sleeper sleeper) {
        this.config = config;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public <T, E extends Exception> T call(@NonNull RetryableOperation<T, E> operation) throws E {
        var session = new RetrySession(config, BackoffOverrides.resolve(config.getNamespace()), clock);

        try (var ignoredNamespaceMDC = MDC.putCloseable(NAMESPACE_MDC_KEY, config.getNamespace().toString())) {
            do {
                session.beforeAttempt();
                try {
                    return operation.call();
                } catch (Exception e) {
                    var backoff = session.onFailure(e);

                    if (backoff.isEmpty()) {
                        throw RetryExecutor.<E>uncheckedCast(session.getLastFailure());
                    }

                    log.debug("Sleeping for {} after attempt {}", backoff.get(), session.getAttempt());
                    this.<E>pause(session, backoff.get());
                }
            } while (true);
        }
    }

    public <E extends Exception> void run(@NonNull RetryableRunnable<E> operation) throws E {
        call(() -> {
            operation.run();
            return null;
        });
    }

    private <E extends Exception> void pause(RetrySession session, Duration duration) throws E {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            log.warn("Retry wait interrupted after attempt {}", session.getAttempt());
            Thread.currentThread().interrupt();

            var lastFailure = session.getLastFailure();
            lastFailure.addSuppressed(e);
            throw RetryExecutor.<E>uncheckedCast(lastFailure);
        }
    }

    // only exceptions thrown by the operation end up here, those are E or unchecked
    @SuppressWarnings("unchecked")
    private static <E extends Exception> E uncheckedCast(Exception exception) {
        return (E) exception;
    }
}
