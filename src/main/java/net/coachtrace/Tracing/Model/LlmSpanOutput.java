package net.coachtrace.Tracing.Model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Output passed to endLLMSpan. When usage is present its token counts and an
 * estimated cost are flattened into the span metadata.
 */
@Getter
@Builder
public class LlmSpanOutput {

    @Singular("outputEntry")
    private final Map<String, Object> output;

    @Nullable
    private final TokenUsage usage;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;
}
