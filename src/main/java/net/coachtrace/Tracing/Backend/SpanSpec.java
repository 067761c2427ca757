package net.coachtrace.Tracing.Backend;

import net.coachtrace.Tracing.Model.SpanType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What the backend receives when a span is opened under a trace or another span.
 */
public class SpanSpec {

    private final String name;
    private final SpanType type;
    private final Map<String, Object> input;
    private final Map<String, Object> metadata;

    public SpanSpec(String name, SpanType type, Map<String, Object> input, Map<String, Object> metadata) {
        this.name = name;
        this.type = type;
        this.input = Collections.unmodifiableMap(new LinkedHashMap<>(input));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getName() {
        return name;
    }

    public SpanType getType() {
        return type;
    }

    public Map<String, Object> getInput() {
        return input;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
