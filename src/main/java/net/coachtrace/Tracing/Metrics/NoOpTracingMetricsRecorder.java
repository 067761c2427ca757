package net.coachtrace.Tracing.Metrics;

import net.coachtrace.Tracing.Model.SpanType;

/**
 * No-Op implementation of TracingMetricsRecorder.
 * Used when no MeterRegistry is available.
 */
public class NoOpTracingMetricsRecorder implements TracingMetricsRecorder {

    @Override
    public void recordTraceCreated() {
        // no-op
    }

    @Override
    public void recordTraceSampledOut() {
        // no-op
    }

    @Override
    public void recordSpanCreated(SpanType type) {
        // no-op
    }

    @Override
    public void recordFlushAttempt(boolean success, long startTime) {
        // no-op
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
