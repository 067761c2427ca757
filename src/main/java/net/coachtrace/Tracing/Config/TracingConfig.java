package net.coachtrace.Tracing.Config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import net.coachtrace.Tracing.Exceptions.TracingConfigurationException;
import org.springframework.util.StringUtils;

/**
 * Resolved, validated tracing configuration. Built once at startup from TracingProperties.
 */
@Getter
@ToString(exclude = "apiKey")
@Builder(toBuilder = true)
public class TracingConfig {

    public static final String DEFAULT_PROJECT_NAME = "financial-coach";
    public static final String DEFAULT_API_URL = "https://www.comet.com/opik/api";
    public static final String DEFAULT_ENVIRONMENT = "development";
    public static final double DEFAULT_SAMPLING_RATE = 1.0;
    public static final long DEFAULT_FLUSH_TIMEOUT_MS = 5000;
    public static final int DEFAULT_FLUSH_RETRY_ATTEMPTS = 3;
    public static final long DEFAULT_FLUSH_RETRY_DELAY_MS = 1000;

    private final String apiKey;
    private final String workspaceName;

    @Builder.Default
    private final String projectName = DEFAULT_PROJECT_NAME;

    @Builder.Default
    private final String apiUrl = DEFAULT_API_URL;

    @Builder.Default
    private final String environment = DEFAULT_ENVIRONMENT;

    @Builder.Default
    private final double samplingRate = DEFAULT_SAMPLING_RATE;

    @Builder.Default
    private final long flushTimeoutMs = DEFAULT_FLUSH_TIMEOUT_MS;

    @Builder.Default
    private final int flushRetryAttempts = DEFAULT_FLUSH_RETRY_ATTEMPTS;

    @Builder.Default
    private final long flushRetryDelayMs = DEFAULT_FLUSH_RETRY_DELAY_MS;

    /**
     * Resolves the properties, applying defaults to blank optional values.
     *
     * @throws TracingConfigurationException when api-key or workspace-name is missing,
     *                                       or a numeric property is out of range
     */
    public static TracingConfig from(TracingProperties properties) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new TracingConfigurationException("coachtrace.tracing.api-key");
        }
        if (!StringUtils.hasText(properties.getWorkspaceName())) {
            throw new TracingConfigurationException("coachtrace.tracing.workspace-name");
        }

        double samplingRate = properties.getSamplingRate();
        if (Double.isNaN(samplingRate) || samplingRate < 0 || samplingRate > 1) {
            throw new TracingConfigurationException("coachtrace.tracing.sampling-rate",
                    "must be between 0 and 1, was " + samplingRate);
        }
        if (properties.getFlushRetryAttempts() < 1) {
            throw new TracingConfigurationException("coachtrace.tracing.flush-retry-attempts",
                    "must be at least 1, was " + properties.getFlushRetryAttempts());
        }
        if (properties.getFlushTimeoutMs() <= 0) {
            throw new TracingConfigurationException("coachtrace.tracing.flush-timeout-ms",
                    "must be positive, was " + properties.getFlushTimeoutMs());
        }
        if (properties.getFlushRetryDelayMs() < 0) {
            throw new TracingConfigurationException("coachtrace.tracing.flush-retry-delay-ms",
                    "must not be negative, was " + properties.getFlushRetryDelayMs());
        }

        return TracingConfig.builder()
                .apiKey(properties.getApiKey())
                .workspaceName(properties.getWorkspaceName())
                .projectName(orDefault(properties.getProjectName(), DEFAULT_PROJECT_NAME))
                .apiUrl(orDefault(properties.getApiUrl(), DEFAULT_API_URL))
                .environment(orDefault(properties.getEnvironment(), DEFAULT_ENVIRONMENT))
                .samplingRate(samplingRate)
                .flushTimeoutMs(properties.getFlushTimeoutMs())
                .flushRetryAttempts(properties.getFlushRetryAttempts())
                .flushRetryDelayMs(properties.getFlushRetryDelayMs())
                .build();
    }

    private static String orDefault(String value, String fallback) {
        return StringUtils.hasText(value) ? value : fallback;
    }
}
