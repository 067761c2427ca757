package net.coachtrace.Tracing.Metrics;

import net.coachtrace.Tracing.Model.SpanType;

/**
 * Interface responsible for recording tracing metrics.
 * Decouples the tracing layer from specific metrics implementations like Micrometer.
 */
public interface TracingMetricsRecorder {

    /**
     * Records a trace that passed sampling and was opened on the backend.
     */
    void recordTraceCreated();

    /**
     * Records a trace dropped by the sampling engine.
     */
    void recordTraceSampledOut();

    /**
     * Records a span opened on the backend.
     *
     * @param type the span type, used as a tag
     */
    void recordSpanCreated(SpanType type);

    /**
     * Records one flush attempt.
     *
     * @param success   whether the attempt completed within its timeout
     * @param startTime the start time of the attempt in milliseconds
     */
    void recordFlushAttempt(boolean success, long startTime);

    /**
     * Checks if metrics recording is available.
     *
     * @return true if metrics recording is enabled and available
     */
    boolean isAvailable();
}
