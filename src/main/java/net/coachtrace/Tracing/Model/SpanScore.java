package net.coachtrace.Tracing.Model;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.UUID;

/**
 * Numeric score attached to a span (latency budget, relevance, confidence...).
 */
@Getter
@ToString
@Builder
public class SpanScore {

    @NonNull
    private final UUID spanId;

    @NonNull
    private final String name;

    private final double value;

    @Nullable
    private final String unit;

    @Nullable
    private final String comment;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;
}
