package org.pak.backoff.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class OverrideCalculatorsTest {
    ManualClock clock = new ManualClock();

    @Test
    void testWaitLessKeepsAttemptBudget() {
        var calculator = new WaitLessBackoffCalculator(clock, 4, 60);

        assertThat(calculator.getBackoff()).contains(Duration.ZERO);
        assertThat(calculator.getBackoff()).contains(Duration.ZERO);
        assertThat(calculator.getBackoff()).contains(Duration.ZERO);
        assertThat(calculator.getBackoff()).isEmpty();
        assertThat(calculator.getBackoff()).isEmpty();
    }

    @Test
    void testWaitLessIgnoresWindow() {
        var calculator = new WaitLessBackoffCalculator(clock, 3, 1);
        clock.advanceTo(1000);

        assertThat(calculator.getBackoff()).contains(Duration.ZERO);
    }

    @Test
    void testWaitLessWithoutBudget() {
        assertThat(new WaitLessBackoffCalculator(clock, 0, 60).getBackoff()).isEmpty();
        assertThat(new WaitLessBackoffCalculator(clock, 1, 60).getBackoff()).isEmpty();
    }

    @Test
    void testNoRetry() {
        var calculator = new NoRetryBackoffCalculator(clock, 100, 3600);

        IntStream.range(0, 3).forEach(i -> assertThat(calculator.getBackoff()).isEmpty());
    }
}
