package org.pak.backoff.core;

public class BackoffFormula {

    private BackoffFormula() {
    }

    /**
     * Solves {@code m * (2^0 + 2^1 + ... + 2^(n-2)) = window} for {@code m}, where {@code n} is the total
     * number of calls. The geometric sum is {@code 2^(n-1) - 1}; it is clamped to 1 so that {@code n <= 2}
     * yields the whole window as the multiplier.
     * <p>
     * For {@code maxCallsTotal = 4} and a window of 120 seconds: {@code m + 2m + 4m = 120}, so {@code m = 120 / 7}.
     */
    public static double calculateExponentialMultiplier(int maxCallsTotal, double windowSeconds) {
        var count = Math.pow(2, maxCallsTotal - 1) - 1;

        return windowSeconds / Math.max(count, 1);
    }
}
