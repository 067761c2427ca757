package net.coachtrace.Tracing.Model;

import lombok.AccessLevel;
import lombok.Getter;
import net.coachtrace.Tracing.Backend.RemoteSpan;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A unit of work inside a trace. traceId always comes from the owning trace or
 * parent span; parentSpanId is only set for nested spans.
 */
@Getter
public class Span {

    private final UUID spanId;
    private final UUID traceId;
    @Nullable
    private final UUID parentSpanId;
    private final SpanType type;
    private final String name;
    private final Instant startedAt;
    private final Map<String, Object> metadata;
    private final RemoteSpan remote;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean ended = new AtomicBoolean(false);

    public Span(UUID spanId, UUID traceId, @Nullable UUID parentSpanId, SpanType type, String name,
                Instant startedAt, Map<String, Object> metadata, RemoteSpan remote) {
        this.spanId = spanId;
        this.traceId = traceId;
        this.parentSpanId = parentSpanId;
        this.type = type;
        this.name = name;
        this.startedAt = startedAt;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.remote = remote;
    }

    /**
     * Marks this span as ended.
     *
     * @return true only for the first call
     */
    public boolean markEnded() {
        return ended.compareAndSet(false, true);
    }

    public boolean isEnded() {
        return ended.get();
    }

    @Override
    public String toString() {
        return "Span{" +
                "spanId=" + spanId +
                ", traceId=" + traceId +
                ", parentSpanId=" + parentSpanId +
                ", type=" + type +
                ", name='" + name + '\'' +
                '}';
    }
}
