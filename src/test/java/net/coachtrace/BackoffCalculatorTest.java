package net.coachtrace;

import net.coachtrace.Tracing.Flush.BackoffCalculator;
import net.coachtrace.Tracing.Flush.RetryPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackoffCalculatorTest {

    @Test
    void testCalculateDelay_ExponentialWithoutJitter() {
        BackoffCalculator calculator = new BackoffCalculator(() -> 0.0);

        assertEquals(1000, calculator.calculateDelay(1000, 1, true));
        assertEquals(2000, calculator.calculateDelay(1000, 2, true));
        assertEquals(4000, calculator.calculateDelay(1000, 3, true));
    }

    @Test
    void testCalculateDelay_JitterAddsUpToThirtyPercent() {
        BackoffCalculator maxJitter = new BackoffCalculator(() -> 0.999);
        BackoffCalculator halfJitter = new BackoffCalculator(() -> 0.5);

        long max = maxJitter.calculateDelay(1000, 1, true);
        assertTrue(max >= 1000 && max < 1300, "Delay should be within [1000, 1300), was: " + max);
        long half = halfJitter.calculateDelay(1000, 1, true);
        assertTrue(half >= 1149 && half <= 1150, "Delay should be about 1150, was: " + half);
    }

    @Test
    void testCalculateDelay_StrictlyIncreasingForFixedRandom() {
        BackoffCalculator calculator = new BackoffCalculator(() -> 0.7);

        long previous = 0;
        for (int attempt = 1; attempt <= 4; attempt++) {
            long delay = calculator.calculateDelay(500, attempt, true);
            assertTrue(delay > previous, "Delay for attempt " + attempt + " should grow, was: " + delay);
            previous = delay;
        }
    }

    @Test
    void testCalculateDelay_CappedAtMaximum() {
        BackoffCalculator calculator = new BackoffCalculator(() -> 0.999);

        assertEquals(BackoffCalculator.MAX_BACKOFF_DELAY_MS, calculator.calculateDelay(1000, 10, true));
        assertEquals(BackoffCalculator.MAX_BACKOFF_DELAY_MS, calculator.calculateDelay(60_000, 1, false));
    }

    @Test
    void testCalculateDelay_ConstantModeIgnoresAttempt() {
        BackoffCalculator calculator = new BackoffCalculator(() -> 0.0);

        assertEquals(1000, calculator.calculateDelay(1000, 1, false));
        assertEquals(1000, calculator.calculateDelay(1000, 5, false));
    }

    @Test
    void testCalculateDelay_FromPolicy() {
        BackoffCalculator calculator = new BackoffCalculator(() -> 0.0);
        RetryPolicy policy = new RetryPolicy(3, 200, 5000, false, true);

        assertEquals(400, calculator.calculateDelay(policy, 2));
    }
}
