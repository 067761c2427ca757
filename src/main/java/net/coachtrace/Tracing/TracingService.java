package net.coachtrace.Tracing;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import net.coachtrace.Tracing.Backend.RemoteSpan;
import net.coachtrace.Tracing.Backend.RemoteTrace;
import net.coachtrace.Tracing.Backend.ScoreSpec;
import net.coachtrace.Tracing.Backend.SpanSpec;
import net.coachtrace.Tracing.Backend.TraceSpec;
import net.coachtrace.Tracing.Backend.TracingBackendClient;
import net.coachtrace.Tracing.Backend.TracingBackendClientFactory;
import net.coachtrace.Tracing.Config.TracingConfig;
import net.coachtrace.Tracing.Config.TracingProperties;
import net.coachtrace.Tracing.Context.TraceContextStore;
import net.coachtrace.Tracing.Exceptions.FlushException;
import net.coachtrace.Tracing.Exceptions.SpanOperationException;
import net.coachtrace.Tracing.Exceptions.TraceOperationException;
import net.coachtrace.Tracing.Exceptions.TracingConfigurationException;
import net.coachtrace.Tracing.Flush.FlushController;
import net.coachtrace.Tracing.Flush.FlushOptions;
import net.coachtrace.Tracing.Flush.RetryPolicy;
import net.coachtrace.Tracing.Headers.TraceHeaderCodec;
import net.coachtrace.Tracing.Metrics.TracingMetricsRecorder;
import net.coachtrace.Tracing.Model.Feedback;
import net.coachtrace.Tracing.Model.LlmProvider;
import net.coachtrace.Tracing.Model.LlmSpanOutput;
import net.coachtrace.Tracing.Model.Span;
import net.coachtrace.Tracing.Model.SpanCompletion;
import net.coachtrace.Tracing.Model.SpanDefinition;
import net.coachtrace.Tracing.Model.SpanOutput;
import net.coachtrace.Tracing.Model.SpanScore;
import net.coachtrace.Tracing.Model.SpanType;
import net.coachtrace.Tracing.Model.TokenUsage;
import net.coachtrace.Tracing.Model.Trace;
import net.coachtrace.Tracing.Model.TraceContext;
import net.coachtrace.Tracing.Model.TraceLinkOptions;
import net.coachtrace.Tracing.Model.TraceOutcome;
import net.coachtrace.Tracing.Model.TraceRequest;
import net.coachtrace.Tracing.Sampling.SamplingEngine;
import net.coachtrace.Tracing.Sampling.SamplingRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point of the tracing layer used by business services.
 *
 * Every method is best effort: a failure inside the tracing layer is logged and turned
 * into a null, false or no-op result so it can never fail the calling operation. The only
 * exception is {@link #flush(FlushOptions)}, whose future fails with a FlushException when
 * the caller asks for it.
 *
 * When api-key or workspace-name is missing the service starts disabled and every
 * method becomes a no-op.
 *
 * Example usage:
 * <pre>
 * Trace trace = tracingService.createAgentTrace("shark_auditor", userId, input, null);
 * Span span = tracingService.createLLMSpan(trace, "analyze", prompt, "claude-sonnet", LlmProvider.ANTHROPIC, null);
 * ...
 * tracingService.endLLMSpan(span, LlmSpanOutput.builder().output(result).usage(usage).build());
 * tracingService.endTrace(trace, TraceOutcome.success());
 * </pre>
 */
public class TracingService {

    private static final Logger logger = LoggerFactory.getLogger(TracingService.class);

    static final String AGENT_TRACE_SUFFIX = "_cognitive_chain";
    static final String AGENT_TRACE_VERSION = "1.0";

    // USD per million tokens
    private static final double PROMPT_TOKEN_PRICE = 3;
    private static final double COMPLETION_TOKEN_PRICE = 15;

    private final TracingProperties properties;
    private final TracingBackendClientFactory clientFactory;
    private final SamplingEngine samplingEngine;
    private final TraceContextStore contextStore;
    private final TraceHeaderCodec headerCodec;
    private final FlushController flushController;
    private final TraceRegistry traceRegistry;
    private final TracingMetricsRecorder metricsRecorder;

    private volatile TracingConfig config;
    private volatile TracingBackendClient client;
    private volatile boolean enabled;

    public TracingService(TracingProperties properties,
                          TracingBackendClientFactory clientFactory,
                          SamplingEngine samplingEngine,
                          TraceContextStore contextStore,
                          TraceHeaderCodec headerCodec,
                          FlushController flushController,
                          TraceRegistry traceRegistry,
                          TracingMetricsRecorder metricsRecorder) {
        this.properties = properties;
        this.clientFactory = clientFactory;
        this.samplingEngine = samplingEngine;
        this.contextStore = contextStore;
        this.headerCodec = headerCodec;
        this.flushController = flushController;
        this.traceRegistry = traceRegistry;
        this.metricsRecorder = metricsRecorder;
    }

    // ==========================================
    // LIFECYCLE
    // ==========================================

    /**
     * Resolves the configuration and creates the backend client.
     * Any failure leaves the service disabled.
     */
    @PostConstruct
    public void initialize() {
        if (!properties.isEnabled()) {
            logger.info("tracing disabled by configuration (coachtrace.tracing.enabled=false)");
            disable();
            return;
        }

        try {
            TracingConfig resolved = TracingConfig.from(properties);
            TracingBackendClient created = clientFactory.create(resolved);
            if (created == null) {
                throw new TracingConfigurationException("backend client", "factory returned null");
            }
            this.config = resolved;
            this.client = created;
            this.enabled = true;
            logger.info("tracing initialized for project {} in workspace {} (sampling rate {})",
                    resolved.getProjectName(), resolved.getWorkspaceName(), samplingEngine.getSamplingRate());
        } catch (RuntimeException e) {
            logger.warn("tracing disabled, failed to initialize: {}", e.getMessage());
            disable();
        }
    }

    /**
     * Flushes pending telemetry once, bounded by the configured flush timeout.
     */
    @PreDestroy
    public void destroy() {
        if (!isAvailable()) {
            return;
        }

        long timeoutMs = config.getFlushTimeoutMs();
        CompletableFuture<Void> flush = flush(FlushOptions.builder()
                .timeoutMs(timeoutMs)
                .retryAttempts(1)
                .throwOnError(true)
                .build());
        try {
            flush.get(timeoutMs + 1000, TimeUnit.MILLISECONDS);
            logger.info("traces flushed successfully on shutdown");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("interrupted while flushing traces on shutdown");
        } catch (ExecutionException | TimeoutException e) {
            String reason = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            logger.error("failed to flush traces on shutdown: {}", reason);
        }
    }

    private void disable() {
        this.enabled = false;
        this.client = null;
        this.config = null;
    }

    public boolean isAvailable() {
        return enabled && client != null;
    }

    /**
     * @return the resolved configuration, or null while tracing is disabled
     */
    @Nullable
    public TracingConfig getConfig() {
        return config;
    }

    // ==========================================
    // CONTEXT PROPAGATION
    // ==========================================

    public <T> CompletableFuture<T> runWithContext(TraceContext context, Supplier<? extends CompletionStage<T>> fn) {
        return contextStore.runWithContext(context, fn);
    }

    public <T> T runWithContextSync(TraceContext context, Supplier<T> fn) {
        return contextStore.runWithContextSync(context, fn);
    }

    @Nullable
    public TraceContext getContext() {
        return contextStore.getContext();
    }

    /**
     * Links the current context to a trace of another service. Traces created later in
     * the same scope without explicit link options carry this link. No-op outside a scope.
     */
    public void linkToRemoteTrace(String remoteTraceId, @Nullable TraceLinkOptions options) {
        contextStore.linkToRemoteTrace(remoteTraceId, options);
    }

    @Nullable
    public TraceContext extractContextFromHeaders(@Nullable Map<String, ?> headers) {
        return headerCodec.extract(headers);
    }

    /**
     * @return trace headers for an outgoing request, empty outside a context scope
     */
    public Map<String, String> injectContextToHeaders() {
        return headerCodec.inject(contextStore.getContext());
    }

    // ==========================================
    // TRACES
    // ==========================================

    @Nullable
    public Trace createTrace(TraceRequest request) {
        return createTrace(request, null);
    }

    /**
     * Creates a trace if it passes sampling.
     *
     * @param linkOptions link to a remote trace; when null the latest link registered
     *                    with linkToRemoteTrace in the current scope is used
     * @return the trace, or null when sampled out, disabled or the backend failed
     */
    @Nullable
    public Trace createTrace(TraceRequest request, @Nullable TraceLinkOptions linkOptions) {
        if (request == null || !isClientAvailable()) {
            return null;
        }

        if (!samplingEngine.shouldSample(request.getName(), request.getMetadata())) {
            logger.debug("trace {} sampled out", request.getName());
            metricsRecorder.recordTraceSampledOut();
            return null;
        }

        try {
            Trace trace = openTrace(request, linkOptions);
            traceRegistry.register(trace);
            metricsRecorder.recordTraceCreated();
            return trace;
        } catch (TraceOperationException e) {
            logger.error(e.getMessage());
            return null;
        }
    }

    private Trace openTrace(TraceRequest request, @Nullable TraceLinkOptions linkOptions) {
        UUID traceId = UUID.randomUUID();
        Instant startedAt = Instant.now();

        Map<String, Object> metadata = new LinkedHashMap<>(request.getMetadata());
        metadata.put("traceId", traceId.toString());
        metadata.put("timestamp", startedAt.toString());
        metadata.put("environment", config.getEnvironment());

        TraceLinkOptions link = linkOptions != null ? linkOptions : contextStore.getCurrentLink();
        if (link != null) {
            metadata.put("linkedTrace", link.toMetadata());
        }

        TraceContext parent = contextStore.getContext();
        if (parent != null && parent.isRemote()) {
            metadata.put("parentTraceId", parent.getTraceId());
            metadata.put("parentSpanId", parent.getSpanId());
            metadata.put("propagatedFrom", "remote");
        }

        try {
            RemoteTrace remote = client.createTrace(
                    new TraceSpec(request.getName(), request.getInput(), metadata, request.getTags()));
            return new Trace(traceId, request.getName(), startedAt, metadata, request.getTags(), remote);
        } catch (RuntimeException e) {
            throw new TraceOperationException("create", request.getName(), e);
        }
    }

    /**
     * Creates a trace named {@code <agentName>_cognitive_chain}. userId is added to the
     * input, agent and version to the metadata; caller values win on key clashes.
     */
    @Nullable
    public Trace createAgentTrace(String agentName, String userId,
                                  @Nullable Map<String, Object> input,
                                  @Nullable Map<String, Object> metadata) {
        Map<String, Object> agentInput = new LinkedHashMap<>();
        agentInput.put("userId", userId);
        agentInput.putAll(orEmpty(input));

        Map<String, Object> agentMetadata = new LinkedHashMap<>();
        agentMetadata.put("agent", agentName);
        agentMetadata.put("version", AGENT_TRACE_VERSION);
        agentMetadata.putAll(orEmpty(metadata));

        return createTrace(TraceRequest.builder()
                .name(agentName + AGENT_TRACE_SUFFIX)
                .input(agentInput)
                .metadata(agentMetadata)
                .build());
    }

    /**
     * Creates a trace and runs fn within a context scope for it. When the trace is
     * sampled out or tracing is disabled fn still runs, with null.
     *
     * The trace ends when the stage returned by fn completes, with a failure outcome
     * if it completes exceptionally. Calling endTrace from fn first is allowed; the
     * second end is ignored.
     */
    public <T> CompletableFuture<T> withTrace(TraceRequest request,
                                              Function<Trace, ? extends CompletionStage<T>> fn) {
        Trace trace = createTrace(request);
        if (trace == null) {
            try {
                CompletionStage<T> stage = fn.apply(null);
                return stage != null ? stage.toCompletableFuture() : CompletableFuture.completedFuture(null);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        return contextStore.runWithContext(TraceContext.of(trace), () -> fn.apply(trace))
                .whenComplete((value, error) -> endTrace(trace, error == null
                        ? TraceOutcome.success()
                        : TraceOutcome.failure(describe(error))));
    }

    private static String describe(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * Ends a trace with its outcome and duration. Null traces and repeated calls are ignored.
     */
    public void endTrace(@Nullable Trace trace, @Nullable TraceOutcome outcome) {
        if (trace == null) {
            return;
        }
        if (!trace.markEnded()) {
            logger.debug("trace {} already ended", trace.getTraceId());
            return;
        }

        TraceOutcome result = outcome != null ? outcome : TraceOutcome.success();
        try {
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("success", result.isSuccess());
            output.put("durationMs", durationSince(trace.getStartedAt()));
            output.putAll(result.getResult());
            if (result.getError() != null) {
                output.put("error", result.getError());
            }
            trace.getRemote().end(output);
        } catch (RuntimeException e) {
            logger.error(new TraceOperationException("end", trace.getTraceName(), e).getMessage());
        } finally {
            traceRegistry.retire(trace);
        }
    }

    // ==========================================
    // SPANS
    // ==========================================

    /**
     * Creates an llm span. model and provider are added to the metadata.
     */
    @Nullable
    public Span createLLMSpan(@Nullable Trace trace, String name, @Nullable Map<String, Object> input,
                              String model, LlmProvider provider, @Nullable Map<String, Object> metadata) {
        Map<String, Object> llmMetadata = new LinkedHashMap<>();
        llmMetadata.put("model", model);
        llmMetadata.put("provider", provider != null ? provider.getValue() : null);
        llmMetadata.putAll(orEmpty(metadata));
        return createSpanInternal(trace, name, SpanType.LLM, input, llmMetadata);
    }

    @Nullable
    public Span createToolSpan(@Nullable Trace trace, String name, @Nullable Map<String, Object> input,
                               @Nullable Map<String, Object> metadata) {
        return createSpanInternal(trace, name, SpanType.TOOL, input, metadata);
    }

    @Nullable
    public Span createRetrievalSpan(@Nullable Trace trace, String name, @Nullable Map<String, Object> query,
                                    @Nullable Map<String, Object> metadata) {
        return createSpanInternal(trace, name, SpanType.RETRIEVAL, query, metadata);
    }

    @Nullable
    public Span createGeneralSpan(@Nullable Trace trace, String name, @Nullable Map<String, Object> input,
                                  @Nullable Map<String, Object> metadata) {
        return createSpanInternal(trace, name, SpanType.GENERAL, input, metadata);
    }

    /**
     * Creates a span under another span. It inherits the parent's traceId and
     * records the parent's spanId.
     */
    @Nullable
    public Span createNestedSpan(@Nullable Span parentSpan, String name, SpanType type,
                                 @Nullable Map<String, Object> input, @Nullable Map<String, Object> metadata) {
        if (parentSpan == null) {
            return null;
        }
        try {
            return openSpan(parentSpan.getRemote()::span, parentSpan.getTraceId(), parentSpan.getSpanId(),
                    name, type, input, metadata);
        } catch (SpanOperationException e) {
            logger.error(e.getMessage());
            return null;
        }
    }

    /**
     * Creates one span per definition. The result is positional: a definition that
     * failed yields null in its slot and a null trace yields a list of nulls.
     */
    public List<Span> createSpanBatch(@Nullable Trace trace, @Nullable List<SpanDefinition> definitions) {
        if (definitions == null) {
            return new ArrayList<>();
        }

        List<Span> spans = new ArrayList<>(definitions.size());
        for (SpanDefinition definition : definitions) {
            if (trace == null || definition == null) {
                spans.add(null);
                continue;
            }
            spans.add(createSpanInternal(trace, definition.getName(), definition.getType(),
                    definition.getInput(), definition.getMetadata()));
        }
        return spans;
    }

    @Nullable
    private Span createSpanInternal(@Nullable Trace trace, String name, SpanType type,
                                    @Nullable Map<String, Object> input, @Nullable Map<String, Object> metadata) {
        if (trace == null) {
            return null;
        }
        try {
            return openSpan(trace.getRemote()::span, trace.getTraceId(), null, name, type, input, metadata);
        } catch (SpanOperationException e) {
            logger.error(e.getMessage());
            return null;
        }
    }

    private Span openSpan(Function<SpanSpec, RemoteSpan> parent, UUID traceId, @Nullable UUID parentSpanId,
                          String name, SpanType type,
                          @Nullable Map<String, Object> input, @Nullable Map<String, Object> metadata) {
        UUID spanId = UUID.randomUUID();

        Map<String, Object> spanMetadata = new LinkedHashMap<>(orEmpty(metadata));
        spanMetadata.put("spanId", spanId.toString());
        if (parentSpanId != null) {
            spanMetadata.put("parentSpanId", parentSpanId.toString());
        }

        try {
            RemoteSpan remote = parent.apply(new SpanSpec(name, type, orEmpty(input), spanMetadata));
            metricsRecorder.recordSpanCreated(type);
            return new Span(spanId, traceId, parentSpanId, type, name, Instant.now(), spanMetadata, remote);
        } catch (RuntimeException e) {
            throw new SpanOperationException("create", name, type, e);
        }
    }

    /**
     * Ends a span. durationMs is always added to the metadata. Null spans and
     * repeated calls are ignored.
     */
    public void endSpan(@Nullable Span span, @Nullable SpanOutput output) {
        if (span == null || !markSpanEnded(span)) {
            return;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("durationMs", durationSince(span.getStartedAt()));
        Map<String, Object> result = Collections.emptyMap();
        if (output != null) {
            metadata.putAll(output.getMetadata());
            result = output.getOutput();
        }
        finishSpan(span, result, metadata);
    }

    /**
     * Ends an llm span. Token usage is flattened into promptTokens, completionTokens and
     * totalTokens metadata, together with an estimatedCostUSD at $3 and $15 per million
     * prompt and completion tokens.
     */
    public void endLLMSpan(@Nullable Span span, @Nullable LlmSpanOutput output) {
        if (span == null || !markSpanEnded(span)) {
            return;
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("durationMs", durationSince(span.getStartedAt()));
        Map<String, Object> result = Collections.emptyMap();
        if (output != null) {
            TokenUsage usage = output.getUsage();
            if (usage != null) {
                metadata.put("promptTokens", usage.getPromptTokens());
                metadata.put("completionTokens", usage.getCompletionTokens());
                metadata.put("totalTokens", usage.getTotalTokens());
                metadata.put("estimatedCostUSD", estimateCost(usage));
            }
            metadata.putAll(output.getMetadata());
            result = output.getOutput();
        }
        finishSpan(span, result, metadata);
    }

    /**
     * Ends every span of the batch. Null entries and null spans are skipped without
     * affecting the others.
     */
    public void endSpanBatch(@Nullable List<SpanCompletion> completions) {
        if (completions == null) {
            return;
        }
        for (SpanCompletion completion : completions) {
            if (completion == null) {
                continue;
            }
            endSpan(completion.getSpan(), SpanOutput.builder()
                    .output(completion.getOutput())
                    .metadata(completion.getMetadata())
                    .build());
        }
    }

    private boolean markSpanEnded(Span span) {
        if (!span.markEnded()) {
            logger.debug("span {} already ended", span.getSpanId());
            return false;
        }
        return true;
    }

    private void finishSpan(Span span, Map<String, Object> output, Map<String, Object> metadata) {
        try {
            span.getRemote().end(output, metadata);
        } catch (RuntimeException e) {
            logger.error(new SpanOperationException("end", span.getName(), span.getType(), e).getMessage());
        }
    }

    static double estimateCost(TokenUsage usage) {
        return (usage.getPromptTokens() * PROMPT_TOKEN_PRICE
                + usage.getCompletionTokens() * COMPLETION_TOKEN_PRICE) / 1_000_000;
    }

    // ==========================================
    // FEEDBACK & SCORES
    // ==========================================

    /**
     * Records a feedback score on a trace. Feedback on a trace this process no longer
     * knows about is still sent.
     *
     * @return false when tracing is disabled or the backend failed
     */
    public boolean addFeedback(@Nullable Feedback feedback) {
        if (feedback == null || !isClientAvailable()) {
            return false;
        }

        try {
            if (traceRegistry.find(feedback.getTraceId()) == null) {
                logger.debug("trace {} not in registry (may have expired), sending feedback {}={} anyway",
                        feedback.getTraceId(), feedback.getName(), feedback.getValue());
            }
            client.logFeedbackScore(new ScoreSpec(
                    feedback.getTraceId(),
                    feedback.getName(),
                    feedback.getValue(),
                    feedback.getCategory() != null ? feedback.getCategory().getValue() : null,
                    feedback.getComment(),
                    feedback.getSource(),
                    null,
                    feedback.getMetadata()));
            return true;
        } catch (RuntimeException e) {
            logger.error("failed to add feedback to trace {}: {}", feedback.getTraceId(), e.getMessage());
            return false;
        }
    }

    /**
     * Records a score on a span.
     *
     * @return false when tracing is disabled or the backend failed
     */
    public boolean addSpanScore(@Nullable SpanScore score) {
        if (score == null || !isClientAvailable()) {
            return false;
        }

        try {
            client.logSpanScore(new ScoreSpec(
                    score.getSpanId(),
                    score.getName(),
                    score.getValue(),
                    null,
                    score.getComment(),
                    null,
                    score.getUnit(),
                    score.getMetadata()));
            return true;
        } catch (RuntimeException e) {
            logger.error("failed to add score to span {}: {}", score.getSpanId(), e.getMessage());
            return false;
        }
    }

    // ==========================================
    // SAMPLING
    // ==========================================

    public void setSamplingRate(double rate) {
        samplingEngine.setSamplingRate(rate);
    }

    public double getSamplingRate() {
        return samplingEngine.getSamplingRate();
    }

    public void setSamplingRules(List<SamplingRule> rules) {
        samplingEngine.setSamplingRules(rules);
    }

    public List<SamplingRule> getSamplingRules() {
        return samplingEngine.getSamplingRules();
    }

    // ==========================================
    // FLUSH
    // ==========================================

    public CompletableFuture<Void> flush() {
        return flush(null);
    }

    /**
     * Sends pending telemetry to the backend, retrying with backoff.
     *
     * @return a future that completes normally unless options.throwOnError was set and
     * every attempt failed, in which case it fails with a FlushException
     */
    public CompletableFuture<Void> flush(@Nullable FlushOptions options) {
        if (!isClientAvailable()) {
            return CompletableFuture.completedFuture(null);
        }

        RetryPolicy policy;
        try {
            policy = RetryPolicy.resolve(options, config);
        } catch (IllegalArgumentException e) {
            logger.error("invalid flush options {}: {}", options, e.getMessage());
            if (options != null && Boolean.TRUE.equals(options.getThrowOnError())) {
                return CompletableFuture.failedFuture(new FlushException(0, e));
            }
            return CompletableFuture.completedFuture(null);
        }

        return flushController.flush(client, policy);
    }

    // ==========================================
    // HELPERS
    // ==========================================

    private boolean isClientAvailable() {
        if (!isAvailable()) {
            logger.debug("tracing client not available, skipping operation");
            return false;
        }
        return true;
    }

    private static long durationSince(Instant startedAt) {
        return Math.max(0, Duration.between(startedAt, Instant.now()).toMillis());
    }

    private static Map<String, Object> orEmpty(@Nullable Map<String, Object> values) {
        return values != null ? values : Collections.emptyMap();
    }
}
