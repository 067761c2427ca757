package net.coachtrace.Tracing.Backend;

import java.util.Map;

/**
 * Backend handle for an open span.
 */
public interface RemoteSpan {

    /**
     * Opens a span nested under this one.
     */
    RemoteSpan span(SpanSpec spec);

    /**
     * Closes the span. Metadata here is merged over the metadata given at creation.
     */
    void end(Map<String, Object> output, Map<String, Object> metadata);
}
