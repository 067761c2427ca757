package net.coachtrace.Tracing.Flush;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Calculator for flush retry delays.
 */
public class BackoffCalculator {

    public static final long MAX_BACKOFF_DELAY_MS = 30_000;
    private static final double JITTER_FACTOR = 0.3;

    private final DoubleSupplier random;

    public BackoffCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in [0, 1)
     */
    public BackoffCalculator(DoubleSupplier random) {
        this.random = random;
    }

    /**
     * Delay before the attempt following the given one.
     * Formula: min(base + random * 0.3 * base, 30000), with base = retryDelay * 2^(attempt - 1)
     * for exponential backoff and retryDelay otherwise.
     *
     * @param attempt the attempt that just failed, starting at 1
     */
    public long calculateDelay(RetryPolicy policy, int attempt) {
        return calculateDelay(policy.getRetryDelayMs(), attempt, policy.isExponentialBackoff());
    }

    public long calculateDelay(long retryDelayMs, int attempt, boolean exponentialBackoff) {
        double base = exponentialBackoff
                ? retryDelayMs * Math.pow(2, Math.max(0, attempt - 1))
                : retryDelayMs;

        // up to 30% of base
        double jitter = random.getAsDouble() * JITTER_FACTOR * base;

        return (long) Math.min(base + jitter, MAX_BACKOFF_DELAY_MS);
    }
}
