package net.coachtrace.Tracing.Backend;

import java.util.Map;

/**
 * Backend handle for an open trace.
 */
public interface RemoteTrace {

    /**
     * Opens a top-level span in this trace.
     */
    RemoteSpan span(SpanSpec spec);

    /**
     * Closes the trace with its final output.
     */
    void end(Map<String, Object> output);
}
