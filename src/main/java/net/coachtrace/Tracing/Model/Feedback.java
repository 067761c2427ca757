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
 * Feedback score attached to a trace, for example a user rating of an agent answer.
 */
@Getter
@ToString
@Builder
public class Feedback {

    @NonNull
    private final UUID traceId;

    @NonNull
    private final String name;

    private final double value;

    @Nullable
    private final FeedbackCategory category;

    @Nullable
    private final String comment;

    @Nullable
    private final String source;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;
}
