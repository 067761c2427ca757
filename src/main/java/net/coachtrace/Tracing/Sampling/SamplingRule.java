package net.coachtrace.Tracing.Sampling;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A conditional sampling rate.
 *
 * A rule matches a trace when every entry of match is present in the trace metadata
 * with an equal value and, if traceNamePattern is set, the pattern is found in the
 * trace name. Rules are plain data so they can be declared in configuration or JSON:
 * <pre>
 * [{"name": "always_sample_shark", "match": {"agent": "shark_auditor"}, "rate": 1.0}]
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SamplingRule {

    @Nullable
    private final String name;
    private final Map<String, String> match;
    @Nullable
    private final String traceNamePattern;
    private final double rate;

    @Nullable
    @JsonIgnore
    private final Pattern compiledPattern;

    /**
     * @throws IllegalArgumentException when rate is outside [0, 1] or the pattern does not compile
     */
    @JsonCreator
    public SamplingRule(@JsonProperty("name") @Nullable String name,
                        @JsonProperty("match") @Nullable Map<String, String> match,
                        @JsonProperty("traceNamePattern") @Nullable String traceNamePattern,
                        @JsonProperty("rate") double rate) {
        if (Double.isNaN(rate) || rate < 0 || rate > 1) {
            throw new IllegalArgumentException("sampling rule " + name + ": rate must be between 0 and 1, was " + rate);
        }
        this.name = name;
        this.match = match != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(match))
                : Collections.emptyMap();
        this.traceNamePattern = traceNamePattern;
        this.rate = rate;
        try {
            this.compiledPattern = traceNamePattern != null ? Pattern.compile(traceNamePattern) : null;
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("sampling rule " + name + ": invalid traceNamePattern " + traceNamePattern, e);
        }
    }

    public static SamplingRule of(String name, Map<String, String> match, double rate) {
        return new SamplingRule(name, match, null, rate);
    }

    public static SamplingRule forTraceName(String name, String traceNamePattern, double rate) {
        return new SamplingRule(name, null, traceNamePattern, rate);
    }

    /**
     * Checks the rule against a trace. Values are compared with equals, so a
     * metadata value of 1 does not match a rule value of "1".
     */
    public boolean matches(String traceName, @Nullable Map<String, ?> metadata) {
        if (compiledPattern != null && !compiledPattern.matcher(traceName).find()) {
            return false;
        }
        for (Map.Entry<String, String> condition : match.entrySet()) {
            Object actual = metadata != null ? metadata.get(condition.getKey()) : null;
            if (!Objects.equals(actual, condition.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Nullable
    public String getName() {
        return name;
    }

    public Map<String, String> getMatch() {
        return match;
    }

    @Nullable
    public String getTraceNamePattern() {
        return traceNamePattern;
    }

    public double getRate() {
        return rate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SamplingRule that)) return false;
        return Double.compare(that.rate, rate) == 0
                && Objects.equals(name, that.name)
                && match.equals(that.match)
                && Objects.equals(traceNamePattern, that.traceNamePattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, match, traceNamePattern, rate);
    }

    @Override
    public String toString() {
        return "SamplingRule{" +
                "name='" + name + '\'' +
                ", match=" + match +
                ", traceNamePattern='" + traceNamePattern + '\'' +
                ", rate=" + rate +
                '}';
    }
}
