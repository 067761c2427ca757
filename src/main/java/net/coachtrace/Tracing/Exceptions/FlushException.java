package net.coachtrace.Tracing.Exceptions;

/**
 * Flushing telemetry failed on every attempt. Only surfaced when the caller
 * asked for it with FlushOptions.throwOnError.
 */
public class FlushException extends TracingException {

    private final int attempts;

    public FlushException(int attempts, Throwable lastError) {
        super("failed to flush traces after " + attempts + " attempts: " + describe(lastError), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
