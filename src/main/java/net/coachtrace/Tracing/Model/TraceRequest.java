package net.coachtrace.Tracing.Model;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * Parameters for TracingService.createTrace.
 *
 * <pre>
 * TraceRequest.builder()
 *     .name("shark_audit_cognitive_chain")
 *     .inputEntry("userId", "user-123")
 *     .metadataEntry("agent", "shark_auditor")
 *     .tag("production")
 *     .build();
 * </pre>
 */
@Getter
@Builder(toBuilder = true)
public class TraceRequest {

    @NonNull
    private final String name;

    @Singular("inputEntry")
    private final Map<String, Object> input;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;

    @Singular
    private final List<String> tags;

    public static TraceRequest of(String name, Map<String, Object> input) {
        return TraceRequest.builder().name(name).input(input).build();
    }
}
