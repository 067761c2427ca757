package net.coachtrace.Tracing.Metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import net.coachtrace.Tracing.Model.SpanType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of TracingMetricsRecorder.
 */
public class MicrometerTracingMetricsRecorder implements TracingMetricsRecorder {

    private static final Logger logger = LoggerFactory.getLogger(MicrometerTracingMetricsRecorder.class);
    private final MeterRegistry meterRegistry;

    public MicrometerTracingMetricsRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordTraceCreated() {
        try {
            Counter.builder("coachtrace.traces.created")
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record trace created metric: {}", e.getMessage());
        }
    }

    @Override
    public void recordTraceSampledOut() {
        try {
            Counter.builder("coachtrace.traces.sampled_out")
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record sampled out metric: {}", e.getMessage());
        }
    }

    @Override
    public void recordSpanCreated(SpanType type) {
        try {
            Counter.builder("coachtrace.spans.created")
                    .tag("type", type.getValue())
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record span created metric for type {}: {}", type, e.getMessage());
        }
    }

    @Override
    public void recordFlushAttempt(boolean success, long startTime) {
        String outcome = success ? "success" : "failure";
        try {
            Timer.builder("coachtrace.flush.time")
                    .tag("outcome", outcome)
                    .register(meterRegistry)
                    .record(System.currentTimeMillis() - startTime, TimeUnit.MILLISECONDS);

            Counter.builder("coachtrace.flush.attempts")
                    .tag("outcome", outcome)
                    .register(meterRegistry)
                    .increment();
        } catch (Exception e) {
            logger.warn("failed to record flush metrics: {}", e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
