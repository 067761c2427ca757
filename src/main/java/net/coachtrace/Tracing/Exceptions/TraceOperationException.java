package net.coachtrace.Tracing.Exceptions;

/**
 * A backend call failed while creating or ending a trace.
 */
public class TraceOperationException extends TracingException {

    private final String operation;
    private final String traceName;

    public TraceOperationException(String operation, String traceName, Throwable cause) {
        super("failed to " + operation + " trace " + traceName + ": " + cause.getMessage(), cause);
        this.operation = operation;
        this.traceName = traceName;
    }

    public String getOperation() {
        return operation;
    }

    public String getTraceName() {
        return traceName;
    }
}
