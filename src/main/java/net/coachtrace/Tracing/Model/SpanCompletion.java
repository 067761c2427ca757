package net.coachtrace.Tracing.Model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * One element of endSpanBatch. A null span is skipped.
 */
@Getter
@Builder
public class SpanCompletion {

    @Nullable
    private final Span span;

    @Singular("outputEntry")
    private final Map<String, Object> output;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;

    public static SpanCompletion of(@Nullable Span span, Map<String, Object> output) {
        return SpanCompletion.builder().span(span).output(output).build();
    }
}
