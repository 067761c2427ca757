package net.coachtrace.Tracing.Context;

import io.opentelemetry.context.Context;
import io.opentelemetry.context.ContextKey;
import io.opentelemetry.context.Scope;
import net.coachtrace.Tracing.Model.TraceContext;
import net.coachtrace.Tracing.Model.TraceLinkOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Makes a TraceContext available to all code running within a logical operation
 * without passing it around.
 *
 * The context is stored under a key in OpenTelemetry's {@link Context}, which is bound
 * to the current thread. It follows the operation to other threads only through tasks
 * submitted via {@link #executor(Executor)}, {@link #delayedExecutor(long, TimeUnit)} or
 * wrapped with one of the wrap methods; each such task runs with the context that was
 * current when it was submitted. Two operations running concurrently therefore never
 * observe each other's context.
 *
 * Example usage:
 * <pre>
 * store.runWithContext(context, () ->
 *         CompletableFuture.supplyAsync(this::loadGoals, store.executor(ioPool))
 *                 .thenApplyAsync(goals -> score(goals, store.getContext()), store.executor(ioPool)));
 * </pre>
 */
public class TraceContextStore {

    private static final Logger logger = LoggerFactory.getLogger(TraceContextStore.class);

    private static final ContextKey<TraceContext> TRACE_CONTEXT_KEY = ContextKey.named("coachtrace-trace-context");
    private static final ContextKey<AtomicReference<TraceLinkOptions>> TRACE_LINK_KEY = ContextKey.named("coachtrace-trace-link");

    /**
     * Runs fn with context as the current context and returns its result.
     *
     * Continuations fn schedules through this store's executors keep the context.
     * The previous context is restored when fn returns, and a RuntimeException thrown
     * by fn is returned as a failed future.
     */
    public <T> CompletableFuture<T> runWithContext(TraceContext context, Supplier<? extends CompletionStage<T>> fn) {
        Objects.requireNonNull(fn, "fn");
        try (TraceScope ignored = openScope(context)) {
            CompletionStage<T> stage = fn.get();
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Synchronous variant of runWithContext. Exceptions thrown by fn propagate
     * after the previous context has been restored.
     */
    public <T> T runWithContextSync(TraceContext context, Supplier<T> fn) {
        Objects.requireNonNull(fn, "fn");
        try (TraceScope ignored = openScope(context)) {
            return fn.get();
        }
    }

    /**
     * Installs context as current until the returned scope is closed.
     * Useful when the scoped code throws checked exceptions.
     */
    public TraceScope openScope(TraceContext context) {
        Objects.requireNonNull(context, "context");
        Context scoped = Context.current()
                .with(TRACE_CONTEXT_KEY, context)
                .with(TRACE_LINK_KEY, new AtomicReference<>());
        Scope scope = scoped.makeCurrent();
        return new TraceScope(scope, context);
    }

    /**
     * @return the context of the innermost enclosing scope, or null outside any scope
     */
    @Nullable
    public TraceContext getContext() {
        return Context.current().get(TRACE_CONTEXT_KEY);
    }

    /**
     * Records a link from the current context to a trace in another service.
     * Traces created later in the same scope carry it as linkedTrace metadata.
     *
     * @return false when there is no current context
     */
    public boolean linkToRemoteTrace(String remoteTraceId, @Nullable TraceLinkOptions options) {
        TraceContext current = getContext();
        AtomicReference<TraceLinkOptions> holder = Context.current().get(TRACE_LINK_KEY);
        if (current == null || holder == null) {
            logger.debug("no current context to link trace to");
            return false;
        }

        TraceLinkOptions link = (options != null ? options.toBuilder() : TraceLinkOptions.builder())
                .remoteTraceId(remoteTraceId)
                .build();
        holder.set(link);

        logger.debug("linked trace {} to remote trace {} ({})", current.getTraceId(), remoteTraceId,
                link.getRelationship() != null ? link.getRelationship() : "linked");
        return true;
    }

    /**
     * @return the latest link registered in the current scope, or null
     */
    @Nullable
    public TraceLinkOptions getCurrentLink() {
        AtomicReference<TraceLinkOptions> holder = Context.current().get(TRACE_LINK_KEY);
        return holder != null ? holder.get() : null;
    }

    /**
     * Wraps an executor so each task runs with the context current at submission.
     */
    public Executor executor(Executor delegate) {
        return Context.taskWrapping(delegate);
    }

    public ExecutorService executorService(ExecutorService delegate) {
        return Context.taskWrapping(delegate);
    }

    /**
     * Executor that runs tasks after the given delay, keeping the submitter's context.
     */
    public Executor delayedExecutor(long delay, TimeUnit unit) {
        return Context.taskWrapping(CompletableFuture.delayedExecutor(delay, unit));
    }

    public Runnable wrap(Runnable runnable) {
        return Context.current().wrap(runnable);
    }

    public <T> Callable<T> wrap(Callable<T> callable) {
        return Context.current().wrap(callable);
    }

    public <T> Supplier<T> wrapSupplier(Supplier<T> supplier) {
        Context captured = Context.current();
        return () -> {
            try (Scope ignored = captured.makeCurrent()) {
                return supplier.get();
            }
        };
    }
}
