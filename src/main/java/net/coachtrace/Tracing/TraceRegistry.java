package net.coachtrace.Tracing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import net.coachtrace.Tracing.Model.Trace;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.UUID;

/**
 * In-memory bookkeeping for traces and spans created by this process.
 *
 * Open traces are kept until they end. Ended traces stay available for a retention
 * window so late feedback can still be correlated.
 */
public class TraceRegistry {

    public static final Duration DEFAULT_RETENTION = Duration.ofMinutes(5);
    private static final Duration OPEN_TRACE_TTL = Duration.ofHours(1);
    private static final long MAX_ENTRIES = 100_000;

    private final Cache<UUID, Trace> openTraces;
    private final Cache<UUID, Trace> endedTraces;

    public TraceRegistry() {
        this(DEFAULT_RETENTION, Ticker.systemTicker());
    }

    public TraceRegistry(Duration retention, Ticker ticker) {
        this.openTraces = Caffeine.newBuilder()
                .maximumSize(MAX_ENTRIES)
                .expireAfterWrite(OPEN_TRACE_TTL)
                .ticker(ticker)
                .build();
        this.endedTraces = Caffeine.newBuilder()
                .maximumSize(MAX_ENTRIES)
                .expireAfterWrite(retention)
                .ticker(ticker)
                .build();
    }

    public void register(Trace trace) {
        openTraces.put(trace.getTraceId(), trace);
    }

    /**
     * Moves an ended trace to the retention window.
     */
    public void retire(Trace trace) {
        openTraces.invalidate(trace.getTraceId());
        endedTraces.put(trace.getTraceId(), trace);
    }

    /**
     * @return the open or recently ended trace with this id, or null
     */
    @Nullable
    public Trace find(UUID traceId) {
        Trace open = openTraces.getIfPresent(traceId);
        return open != null ? open : endedTraces.getIfPresent(traceId);
    }

    public long openTraceCount() {
        openTraces.cleanUp();
        return openTraces.estimatedSize();
    }
}
