package net.coachtrace.Tracing.Model;

import lombok.AccessLevel;
import lombok.Getter;
import net.coachtrace.Tracing.Backend.RemoteTrace;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A recorded trace. Created by TracingService.createTrace and ended once through endTrace.
 */
@Getter
public class Trace {

    private final UUID traceId;
    private final String traceName;
    private final Instant startedAt;
    private final Map<String, Object> metadata;
    private final List<String> tags;

    // backend handle, used by the tracing service to add spans and end the trace
    private final RemoteTrace remote;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean ended = new AtomicBoolean(false);

    public Trace(UUID traceId, String traceName, Instant startedAt,
                 Map<String, Object> metadata, List<String> tags, RemoteTrace remote) {
        this.traceId = traceId;
        this.traceName = traceName;
        this.startedAt = startedAt;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.tags = List.copyOf(tags);
        this.remote = remote;
    }

    /**
     * Marks this trace as ended.
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
        return "Trace{" +
                "traceId=" + traceId +
                ", traceName='" + traceName + '\'' +
                ", startedAt=" + startedAt +
                ", tags=" + tags +
                '}';
    }
}
