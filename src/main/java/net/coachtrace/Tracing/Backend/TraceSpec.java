package net.coachtrace.Tracing.Backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the backend receives when a trace is opened.
 */
public class TraceSpec {

    private final String name;
    private final Map<String, Object> input;
    private final Map<String, Object> metadata;
    private final List<String> tags;

    public TraceSpec(String name, Map<String, Object> input, Map<String, Object> metadata, List<String> tags) {
        this.name = name;
        this.input = Collections.unmodifiableMap(new LinkedHashMap<>(input));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.tags = List.copyOf(tags);
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getInput() {
        return input;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public List<String> getTags() {
        return tags;
    }
}
