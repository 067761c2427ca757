package net.coachtrace.Tracing.Exceptions;

import net.coachtrace.Tracing.Model.SpanType;

/**
 * A backend call failed while creating or ending a span.
 */
public class SpanOperationException extends TracingException {

    private final String operation;
    private final String spanName;
    private final SpanType spanType;

    public SpanOperationException(String operation, String spanName, SpanType spanType, Throwable cause) {
        super("failed to " + operation + " " + spanType.getValue() + " span " + spanName + ": " + cause.getMessage(), cause);
        this.operation = operation;
        this.spanName = spanName;
        this.spanType = spanType;
    }

    public String getOperation() {
        return operation;
    }

    public String getSpanName() {
        return spanName;
    }

    public SpanType getSpanType() {
        return spanType;
    }
}
