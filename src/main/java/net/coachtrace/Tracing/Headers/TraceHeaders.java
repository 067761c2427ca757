package net.coachtrace.Tracing.Headers;

/**
 * Wire header names used to propagate trace context between services.
 */
public final class TraceHeaders {

    public static final String TRACE_ID = "x-trace-id";
    public static final String SPAN_ID = "x-span-id";
    public static final String TRACE_NAME = "x-trace-name";

    // inbound only, used when x-trace-id is absent
    public static final String TRACEPARENT = "traceparent";

    public static final String BAGGAGE = "baggage";

    public static final String DEFAULT_REMOTE_TRACE_NAME = "remote_trace";

    private TraceHeaders() {
    }
}
