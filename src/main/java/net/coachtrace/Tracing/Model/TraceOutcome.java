package net.coachtrace.Tracing.Model;

import lombok.Getter;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final output of a trace, passed to endTrace.
 */
@Getter
public class TraceOutcome {

    private final boolean success;
    private final Map<String, Object> result;
    @Nullable
    private final String error;

    private TraceOutcome(boolean success, @Nullable Map<String, Object> result, @Nullable String error) {
        this.success = success;
        this.result = result != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(result))
                : Collections.emptyMap();
        this.error = error;
    }

    public static TraceOutcome success() {
        return new TraceOutcome(true, null, null);
    }

    public static TraceOutcome success(Map<String, Object> result) {
        return new TraceOutcome(true, result, null);
    }

    public static TraceOutcome failure(String error) {
        return new TraceOutcome(false, null, error);
    }

    public static TraceOutcome failure(String error, Map<String, Object> result) {
        return new TraceOutcome(false, result, error);
    }
}
