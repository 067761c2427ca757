package net.coachtrace.Tracing.Exceptions;

/**
 * Base type for failures raised inside the tracing layer.
 */
public class TracingException extends RuntimeException {

    public TracingException(String message) {
        super(message);
    }

    public TracingException(String message, Throwable cause) {
        super(message, cause);
    }
}
