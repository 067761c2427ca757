package net.coachtrace.Tracing.Model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Token consumption of one LLM call.
 */
@Data
@AllArgsConstructor
public class TokenUsage {
    private final long promptTokens;
    private final long completionTokens;
    private final long totalTokens;

    public static TokenUsage of(long promptTokens, long completionTokens) {
        return new TokenUsage(promptTokens, completionTokens, promptTokens + completionTokens);
    }
}
