package net.coachtrace.Tracing.Backend;

import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A feedback score for a trace or a span score, as sent to the backend.
 * targetId is the trace id for feedback scores and the span id for span scores.
 */
public class ScoreSpec {

    private final UUID id;
    private final UUID targetId;
    private final String name;
    private final double value;
    @Nullable
    private final String category;
    @Nullable
    private final String reason;
    @Nullable
    private final String source;
    @Nullable
    private final String unit;
    private final Map<String, Object> metadata;

    public ScoreSpec(UUID targetId, String name, double value,
                     @Nullable String category, @Nullable String reason,
                     @Nullable String source, @Nullable String unit,
                     Map<String, Object> metadata) {
        this.id = UUID.randomUUID();
        this.targetId = targetId;
        this.name = name;
        this.value = value;
        this.category = category;
        this.reason = reason;
        this.source = source;
        this.unit = unit;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public UUID getId() {
        return id;
    }

    public UUID getTargetId() {
        return targetId;
    }

    public String getName() {
        return name;
    }

    public double getValue() {
        return value;
    }

    @Nullable
    public String getCategory() {
        return category;
    }

    @Nullable
    public String getReason() {
        return reason;
    }

    @Nullable
    public String getSource() {
        return source;
    }

    @Nullable
    public String getUnit() {
        return unit;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
