package net.coachtrace.Tracing.Backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * TracingBackendClient that records traces and spans as OpenTelemetry spans.
 *
 * A trace becomes a root span, every span becomes a child of its trace or parent
 * span. Input, output and metadata maps are stored as JSON string attributes.
 * Scores are recorded as short "score.*" spans linked by attribute to their target.
 *
 * Flushing goes through SdkTracerProvider.forceFlush() when an SDK provider is
 * supplied; with the bare API there is nothing buffered here and flush completes
 * immediately.
 */
public class OpenTelemetryBackendClient implements TracingBackendClient {

    private static final Logger logger = LoggerFactory.getLogger(OpenTelemetryBackendClient.class);
    private static final String INSTRUMENTATION_NAME = "net.coachtrace.tracing";

    static final AttributeKey<String> COMPONENT = AttributeKey.stringKey("coachtrace.component");
    static final AttributeKey<String> TRACE_ID = AttributeKey.stringKey("coachtrace.trace_id");
    static final AttributeKey<String> SPAN_TYPE = AttributeKey.stringKey("coachtrace.span_type");
    static final AttributeKey<String> INPUT = AttributeKey.stringKey("coachtrace.input");
    static final AttributeKey<String> OUTPUT = AttributeKey.stringKey("coachtrace.output");
    static final AttributeKey<String> METADATA = AttributeKey.stringKey("coachtrace.metadata");
    static final AttributeKey<String> SCORE_TARGET = AttributeKey.stringKey("coachtrace.score.target_id");
    static final AttributeKey<Double> SCORE_VALUE = AttributeKey.doubleKey("coachtrace.score.value");

    private final Tracer tracer;
    @Nullable
    private final SdkTracerProvider tracerProvider;
    private final ObjectMapper objectMapper;

    public OpenTelemetryBackendClient(OpenTelemetry openTelemetry,
                                      @Nullable SdkTracerProvider tracerProvider,
                                      ObjectMapper objectMapper) {
        this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME, "0.1.0");
        this.tracerProvider = tracerProvider;
        this.objectMapper = objectMapper;
        logger.info("OpenTelemetryBackendClient initialized - sdk flush {}",
                tracerProvider != null ? "enabled" : "unavailable (api only)");
    }

    @Override
    public RemoteTrace createTrace(TraceSpec spec) {
        Span root = tracer.spanBuilder(spec.getName())
                .setNoParent()
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        root.setAttribute(COMPONENT, "trace");
        root.setAttribute(INPUT, toJson(spec.getInput()));
        root.setAttribute(METADATA, toJson(spec.getMetadata()));
        Object traceId = spec.getMetadata().get("traceId");
        if (traceId != null) {
            root.setAttribute(TRACE_ID, traceId.toString());
        }
        if (!spec.getTags().isEmpty()) {
            root.setAttribute(AttributeKey.stringArrayKey("coachtrace.tags"), spec.getTags());
        }

        return new OpenTelemetryRemoteTrace(root);
    }

    @Override
    public CompletableFuture<Void> flush() {
        if (tracerProvider == null) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<Void> future = new CompletableFuture<>();
        CompletableResultCode result = tracerProvider.forceFlush();
        result.whenComplete(() -> {
            if (result.isSuccess()) {
                future.complete(null);
            } else {
                future.completeExceptionally(new IllegalStateException("OpenTelemetry span export failed"));
            }
        });
        return future;
    }

    @Override
    public void logFeedbackScore(ScoreSpec spec) {
        recordScore("score.trace", spec);
    }

    @Override
    public void logSpanScore(ScoreSpec spec) {
        recordScore("score.span", spec);
    }

    private void recordScore(String spanName, ScoreSpec spec) {
        Span span = tracer.spanBuilder(spanName)
                .setNoParent()
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        span.setAttribute(COMPONENT, "score");
        span.setAttribute(SCORE_TARGET, spec.getTargetId().toString());
        span.setAttribute("coachtrace.score.name", spec.getName());
        span.setAttribute(SCORE_VALUE, spec.getValue());
        if (spec.getCategory() != null) {
            span.setAttribute("coachtrace.score.category", spec.getCategory());
        }
        if (spec.getReason() != null) {
            span.setAttribute("coachtrace.score.reason", spec.getReason());
        }
        if (spec.getSource() != null) {
            span.setAttribute("coachtrace.score.source", spec.getSource());
        }
        if (spec.getUnit() != null) {
            span.setAttribute("coachtrace.score.unit", spec.getUnit());
        }
        if (!spec.getMetadata().isEmpty()) {
            span.setAttribute(METADATA, toJson(spec.getMetadata()));
        }
        span.end();
    }

    private Span startChild(Span parent, SpanSpec spec) {
        Span span = tracer.spanBuilder(spec.getName())
                .setParent(Context.root().with(parent))
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        span.setAttribute(COMPONENT, "span");
        span.setAttribute(SPAN_TYPE, spec.getType().getValue());
        span.setAttribute(INPUT, toJson(spec.getInput()));
        span.setAttribute(METADATA, toJson(spec.getMetadata()));
        return span;
    }

    private String toJson(Map<String, Object> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            logger.debug("failed to serialize attribute map, falling back to toString: {}", e.getMessage());
            return String.valueOf(values);
        }
    }

    private class OpenTelemetryRemoteTrace implements RemoteTrace {

        private final Span root;

        OpenTelemetryRemoteTrace(Span root) {
            this.root = root;
        }

        @Override
        public RemoteSpan span(SpanSpec spec) {
            return new OpenTelemetryRemoteSpan(startChild(root, spec));
        }

        @Override
        public void end(Map<String, Object> output) {
            root.setAttribute(OUTPUT, toJson(output));
            if (Boolean.FALSE.equals(output.get("success"))) {
                Object error = output.get("error");
                root.setStatus(StatusCode.ERROR, error != null ? error.toString() : "failed");
            } else {
                root.setStatus(StatusCode.OK);
            }
            root.end();
        }
    }

    private class OpenTelemetryRemoteSpan implements RemoteSpan {

        private final Span span;

        OpenTelemetryRemoteSpan(Span span) {
            this.span = span;
        }

        @Override
        public RemoteSpan span(SpanSpec spec) {
            return new OpenTelemetryRemoteSpan(startChild(span, spec));
        }

        @Override
        public void end(Map<String, Object> output, Map<String, Object> metadata) {
            span.setAttribute(OUTPUT, toJson(output));
            if (!metadata.isEmpty()) {
                span.setAttribute("coachtrace.end_metadata", toJson(metadata));
            }
            Object durationMs = metadata.get("durationMs");
            if (durationMs instanceof Number number) {
                span.setAttribute("coachtrace.duration_ms", number.longValue());
            }
            span.setStatus(StatusCode.OK);
            span.end();
        }
    }
}
