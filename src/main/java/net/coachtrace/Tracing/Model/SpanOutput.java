package net.coachtrace.Tracing.Model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.Map;

/**
 * Output passed to endSpan. Metadata is merged over the generated durationMs.
 */
@Getter
@Builder
public class SpanOutput {

    @Singular("outputEntry")
    private final Map<String, Object> output;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;

    public static SpanOutput of(Map<String, Object> output) {
        return SpanOutput.builder().output(output).build();
    }
}
