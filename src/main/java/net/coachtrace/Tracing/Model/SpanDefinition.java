package net.coachtrace.Tracing.Model;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.util.Map;

/**
 * One element of createSpanBatch.
 */
@Getter
@Builder
public class SpanDefinition {

    @NonNull
    private final String name;

    @Builder.Default
    private final SpanType type = SpanType.GENERAL;

    @Singular("inputEntry")
    private final Map<String, Object> input;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;
}
