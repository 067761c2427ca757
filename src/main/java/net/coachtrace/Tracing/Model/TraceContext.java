package net.coachtrace.Tracing.Model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * The unit carried by the context store and across process boundaries.
 *
 * traceId is a String because a context extracted from a traceparent header
 * carries the raw header value rather than a UUID. Instances are immutable;
 * baggage is never null.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
public class TraceContext {

    @NonNull
    private final String traceId;

    @Nullable
    private final String spanId;

    @NonNull
    private final String traceName;

    @Singular("baggageItem")
    private final Map<String, String> baggage;

    private final boolean remote;

    /**
     * Local context for a trace created in this process.
     */
    public static TraceContext of(Trace trace) {
        return TraceContext.builder()
                .traceId(trace.getTraceId().toString())
                .traceName(trace.getTraceName())
                .build();
    }

    /**
     * Copy of this context pointing at the given span.
     */
    public TraceContext withSpan(Span span) {
        return toBuilder().spanId(span.getSpanId().toString()).build();
    }
}
