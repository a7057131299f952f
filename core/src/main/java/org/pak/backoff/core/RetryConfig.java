package org.pak.backoff.core;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import lombok.experimental.FieldDefaults;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

import static java.util.Optional.ofNullable;

@FieldDefaults(makeFinal = true, level = lombok.AccessLevel.PRIVATE)
@Getter
@ToString
public class RetryConfig {
    public static final int DEFAULT_MAX_CALLS_TOTAL = 3;
    public static final Duration DEFAULT_RETRY_WINDOW = Duration.of(60, ChronoUnit.SECONDS);

    //total number of calls, the first one included
    int maxCallsTotal;
    //time to spread the retries over, counted from the first call
    Duration retryWindow;
    Namespace namespace;
    RetryablePolicy retryablePolicy;
    ThrottlingPolicy throttlingPolicy;

    @Builder
    private RetryConfig(
            Integer maxCallsTotal,
            Duration retryWindow,
            Namespace namespace,
            @NonNull RetryablePolicy retryablePolicy,
            ThrottlingPolicy throttlingPolicy
    ) {
        this.maxCallsTotal = ofNullable(maxCallsTotal).orElse(DEFAULT_MAX_CALLS_TOTAL);
        this.retryWindow = ofNullable(retryWindow).orElse(DEFAULT_RETRY_WINDOW);
        this.namespace = ofNullable(namespace).orElse(Namespace.DEFAULT);
        this.retryablePolicy = retryablePolicy;
        this.throttlingPolicy = ofNullable(throttlingPolicy).orElseGet(SimpleThrottlingPolicy::new);

        if (this.maxCallsTotal < 0) {
            throw new IllegalArgumentException("Max calls total must not be negative: " + this.maxCallsTotal);
        }

        if (this.retryWindow.isNegative()) {
            throw new IllegalArgumentException("Retry window must not be negative: " + this.retryWindow);
        }
    }

    public double getRetryWindowSeconds() {
        return retryWindow.getSeconds() + retryWindow.getNano() / 1_000_000_000d;
    }
}
