package net.coachtrace.Tracing.Model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Link from a locally created trace to a trace owned by another service.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class TraceLinkOptions {

    /**
     * Overwritten by linkToRemoteTrace with its remoteTraceId argument.
     */
    private final String remoteTraceId;

    @Nullable
    private final String remoteSpanId;

    /**
     * e.g. "child_of" or "follows_from"
     */
    @Nullable
    private final String relationship;

    @Nullable
    private final String remoteService;

    /**
     * The linkedTrace metadata block. Absent fields are kept as null entries.
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> linked = new LinkedHashMap<>();
        linked.put("remoteTraceId", remoteTraceId);
        linked.put("remoteSpanId", remoteSpanId);
        linked.put("relationship", relationship);
        linked.put("remoteService", remoteService);
        return linked;
    }
}
