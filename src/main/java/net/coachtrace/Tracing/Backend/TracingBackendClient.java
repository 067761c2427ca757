package net.coachtrace.Tracing.Backend;

import java.util.concurrent.CompletableFuture;

/**
 * Client for the remote collector that receives traces, spans and scores.
 *
 * Implementations may buffer; flush() drains whatever is buffered. Any method
 * may throw, callers in this library treat every failure as best effort.
 */
public interface TracingBackendClient {

    /**
     * Opens a trace on the backend.
     *
     * @param spec name, input, metadata and tags of the trace
     * @return a handle used to add spans and to end the trace
     */
    RemoteTrace createTrace(TraceSpec spec);

    /**
     * Sends buffered telemetry to the collector.
     *
     * @return a future completing when the backend acknowledged the flush
     */
    CompletableFuture<Void> flush();

    /**
     * Records a feedback score against a trace.
     */
    void logFeedbackScore(ScoreSpec spec);

    /**
     * Records a score against a span.
     */
    void logSpanScore(ScoreSpec spec);
}
