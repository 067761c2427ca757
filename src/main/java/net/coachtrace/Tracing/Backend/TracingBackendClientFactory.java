package net.coachtrace.Tracing.Backend;

import net.coachtrace.Tracing.Config.TracingConfig;

/**
 * Creates the backend client once the configuration has been validated.
 * Register a bean of this type to replace the default OpenTelemetry client.
 */
@FunctionalInterface
public interface TracingBackendClientFactory {

    TracingBackendClient create(TracingConfig config);
}
