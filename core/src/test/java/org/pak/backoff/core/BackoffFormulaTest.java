package org.pak.backoff.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BackoffFormulaTest {

    @Test
    void testMultiplier() {
        assertThat(BackoffFormula.calculateExponentialMultiplier(5, 120)).isEqualTo(8.0);
        assertThat(BackoffFormula.calculateExponentialMultiplier(4, 120)).isCloseTo(120.0 / 7, within(1e-9));
    }

    @Test
    void testFewCallsUseWholeWindow() {
        assertThat(BackoffFormula.calculateExponentialMultiplier(2, 120)).isEqualTo(120.0);
        assertThat(BackoffFormula.calculateExponentialMultiplier(1, 120)).isEqualTo(120.0);
        assertThat(BackoffFormula.calculateExponentialMultiplier(0, 120)).isEqualTo(120.0);
    }

    @Test
    void testWaitsSumUpToWindow() {
        var maxCallsTotal = 6;
        var multiplier = BackoffFormula.calculateExponentialMultiplier(maxCallsTotal, 93);

        var sum = 0.0;
        for (int k = 0; k <= maxCallsTotal - 2; k++) {
            sum += multiplier * Math.pow(2, k);
        }

        assertThat(sum).isCloseTo(93.0, within(1e-9));
    }

    @Test
    void testHugeCallCount() {
        assertThat(BackoffFormula.calculateExponentialMultiplier(5000, 60)).isEqualTo(0.0);
        assertThat(BackoffFormula.calculateExponentialMultiplier(3, 0)).isEqualTo(0.0);
    }
}
