package net.coachtrace.Tracing.Flush;

import lombok.Getter;
import lombok.ToString;
import net.coachtrace.Tracing.Config.TracingConfig;
import org.springframework.lang.Nullable;

/**
 * Fully resolved retry settings of one flush call.
 */
@Getter
@ToString
public class RetryPolicy {

    private final int retryAttempts;
    private final long retryDelayMs;
    private final long timeoutMs;
    private final boolean throwOnError;
    private final boolean exponentialBackoff;

    public RetryPolicy(int retryAttempts, long retryDelayMs, long timeoutMs,
                       boolean throwOnError, boolean exponentialBackoff) {
        if (retryAttempts < 1) {
            throw new IllegalArgumentException("retryAttempts must be at least 1, was " + retryAttempts);
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retryDelayMs must not be negative, was " + retryDelayMs);
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, was " + timeoutMs);
        }
        this.retryAttempts = retryAttempts;
        this.retryDelayMs = retryDelayMs;
        this.timeoutMs = timeoutMs;
        this.throwOnError = throwOnError;
        this.exponentialBackoff = exponentialBackoff;
    }

    /**
     * Applies caller overrides on top of the configured flush settings.
     */
    public static RetryPolicy resolve(@Nullable FlushOptions options, TracingConfig config) {
        FlushOptions o = options != null ? options : FlushOptions.defaults();
        return new RetryPolicy(
                o.getRetryAttempts() != null ? o.getRetryAttempts() : config.getFlushRetryAttempts(),
                o.getRetryDelayMs() != null ? o.getRetryDelayMs() : config.getFlushRetryDelayMs(),
                o.getTimeoutMs() != null ? o.getTimeoutMs() : config.getFlushTimeoutMs(),
                o.getThrowOnError() != null && o.getThrowOnError(),
                o.getExponentialBackoff() == null || o.getExponentialBackoff()
        );
    }
}
