package net.coachtrace.Tracing.Context;

import io.opentelemetry.context.Scope;
import net.coachtrace.Tracing.Model.TraceContext;

/**
 * Scope during which a TraceContext is the current one.
 * This must be closed when the scope ends (use try-with-resources).
 *
 * Example usage:
 * <pre>
 * try (TraceScope scope = contextStore.openScope(context)) {
 *     // contextStore.getContext() returns context here
 * }
 * </pre>
 */
public class TraceScope implements AutoCloseable {

    private final Scope scope;
    private final TraceContext context;

    TraceScope(Scope scope, TraceContext context) {
        this.scope = scope;
        this.context = context;
    }

    public TraceContext getContext() {
        return context;
    }

    /**
     * Closes the scope. This restores the context that was current when it was opened.
     * Unlike AutoCloseable.close(), this method does not throw exceptions.
     */
    @Override
    public void close() {
        scope.close();
    }
}
