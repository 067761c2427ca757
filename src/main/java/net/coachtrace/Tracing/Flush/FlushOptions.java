package net.coachtrace.Tracing.Flush;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.lang.Nullable;

/**
 * Per-call overrides for TracingService.flush. Unset fields fall back to the configured defaults.
 */
@Getter
@ToString
@Builder
public class FlushOptions {

    @Nullable
    private final Integer retryAttempts;

    @Nullable
    private final Long retryDelayMs;

    @Nullable
    private final Long timeoutMs;

    /**
     * Complete the flush future with a FlushException when every attempt failed.
     * Default: false
     */
    @Nullable
    private final Boolean throwOnError;

    /**
     * Default: true
     */
    @Nullable
    private final Boolean exponentialBackoff;

    public static FlushOptions defaults() {
        return FlushOptions.builder().build();
    }
}
