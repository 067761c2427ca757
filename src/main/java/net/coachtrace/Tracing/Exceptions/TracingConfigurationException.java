package net.coachtrace.Tracing.Exceptions;

/**
 * Thrown while resolving the configuration when a required property is missing or invalid.
 * TracingService turns it into the disabled state.
 */
public class TracingConfigurationException extends TracingException {

    private final String missingKey;

    public TracingConfigurationException(String missingKey) {
        super("tracing configuration error: missing " + missingKey);
        this.missingKey = missingKey;
    }

    public TracingConfigurationException(String key, String message) {
        super("tracing configuration error: " + key + " " + message);
        this.missingKey = key;
    }

    public String getMissingKey() {
        return missingKey;
    }
}
