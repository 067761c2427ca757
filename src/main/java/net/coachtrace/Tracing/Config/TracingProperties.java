package net.coachtrace.Tracing.Config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the tracing layer.
 * These properties can be configured in application.properties with the prefix "coachtrace.tracing".
 *
 * They are read once at startup and resolved into an immutable TracingConfig.
 */
@ConfigurationProperties(prefix = "coachtrace.tracing")
public class TracingProperties {

    /**
     * Enable or disable tracing globally.
     * Default: true
     */
    private boolean enabled = true;

    /**
     * API key of the trace collector. Required.
     */
    private String apiKey;

    /**
     * Workspace on the trace collector. Required.
     */
    private String workspaceName;

    /**
     * Default: financial-coach
     */
    private String projectName = TracingConfig.DEFAULT_PROJECT_NAME;

    /**
     * Default: https://www.comet.com/opik/api
     */
    private String apiUrl = TracingConfig.DEFAULT_API_URL;

    /**
     * Stamped on every trace as metadata.environment.
     * Default: development
     */
    private String environment = TracingConfig.DEFAULT_ENVIRONMENT;

    /**
     * Probability in [0, 1] that a trace matching no sampling rule is recorded.
     * Default: 1.0
     */
    private double samplingRate = TracingConfig.DEFAULT_SAMPLING_RATE;

    /**
     * Timeout of a single flush attempt.
     * Default: 5000
     */
    private long flushTimeoutMs = TracingConfig.DEFAULT_FLUSH_TIMEOUT_MS;

    /**
     * Default: 3
     */
    private int flushRetryAttempts = TracingConfig.DEFAULT_FLUSH_RETRY_ATTEMPTS;

    /**
     * Base delay between flush attempts.
     * Default: 1000
     */
    private long flushRetryDelayMs = TracingConfig.DEFAULT_FLUSH_RETRY_DELAY_MS;

    private Sampling sampling = new Sampling();

    private HttpFilter httpFilter = new HttpFilter();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getWorkspaceName() {
        return workspaceName;
    }

    public void setWorkspaceName(String workspaceName) {
        this.workspaceName = workspaceName;
    }

    public String getProjectName() {
        return projectName;
    }

    public void setProjectName(String projectName) {
        this.projectName = projectName;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public void setApiUrl(String apiUrl) {
        this.apiUrl = apiUrl;
    }

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public double getSamplingRate() {
        return samplingRate;
    }

    public void setSamplingRate(double samplingRate) {
        this.samplingRate = samplingRate;
    }

    public long getFlushTimeoutMs() {
        return flushTimeoutMs;
    }

    public void setFlushTimeoutMs(long flushTimeoutMs) {
        this.flushTimeoutMs = flushTimeoutMs;
    }

    public int getFlushRetryAttempts() {
        return flushRetryAttempts;
    }

    public void setFlushRetryAttempts(int flushRetryAttempts) {
        this.flushRetryAttempts = flushRetryAttempts;
    }

    public long getFlushRetryDelayMs() {
        return flushRetryDelayMs;
    }

    public void setFlushRetryDelayMs(long flushRetryDelayMs) {
        this.flushRetryDelayMs = flushRetryDelayMs;
    }

    public Sampling getSampling() {
        return sampling;
    }

    public void setSampling(Sampling sampling) {
        this.sampling = sampling;
    }

    public HttpFilter getHttpFilter() {
        return httpFilter;
    }

    public void setHttpFilter(HttpFilter httpFilter) {
        this.httpFilter = httpFilter;
    }

    @Override
    public String toString() {
        return "TracingProperties{" +
                "enabled=" + enabled +
                ", apiKey=" + (apiKey != null ? "****" : null) +
                ", workspaceName='" + workspaceName + '\'' +
                ", projectName='" + projectName + '\'' +
                ", apiUrl='" + apiUrl + '\'' +
                ", environment='" + environment + '\'' +
                ", samplingRate=" + samplingRate +
                ", flushTimeoutMs=" + flushTimeoutMs +
                ", flushRetryAttempts=" + flushRetryAttempts +
                ", flushRetryDelayMs=" + flushRetryDelayMs +
                ", rules=" + sampling.rules.size() +
                '}';
    }

    public static class Sampling {

        /**
         * Rules declared inline, evaluated before any loaded from rulesLocation.
         */
        private List<Rule> rules = new ArrayList<>();

        /**
         * Spring resource location of a JSON array of rules, e.g. classpath:sampling-rules.json
         */
        private String rulesLocation;

        public List<Rule> getRules() {
            return rules;
        }

        public void setRules(List<Rule> rules) {
            this.rules = rules;
        }

        public String getRulesLocation() {
            return rulesLocation;
        }

        public void setRulesLocation(String rulesLocation) {
            this.rulesLocation = rulesLocation;
        }
    }

    public static class Rule {
        private String name;
        private Map<String, String> match = new LinkedHashMap<>();
        private String traceNamePattern;
        private double rate = 1.0;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public Map<String, String> getMatch() {
            return match;
        }

        public void setMatch(Map<String, String> match) {
            this.match = match;
        }

        public String getTraceNamePattern() {
            return traceNamePattern;
        }

        public void setTraceNamePattern(String traceNamePattern) {
            this.traceNamePattern = traceNamePattern;
        }

        public double getRate() {
            return rate;
        }

        public void setRate(double rate) {
            this.rate = rate;
        }
    }

    public static class HttpFilter {

        /**
         * Register the servlet filter that extracts trace context from inbound requests.
         * Default: true
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
