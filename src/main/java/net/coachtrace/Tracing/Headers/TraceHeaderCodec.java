package net.coachtrace.Tracing.Headers;

import net.coachtrace.Tracing.Model.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Reads and writes TraceContext from and to wire headers.
 *
 * Header names are matched case-insensitively. A header value may be a String, a
 * String[] or a Collection; for multi-valued headers the first value is used.
 * Baggage is written as key=value pairs separated by commas with percent-encoded
 * values, and decoded the same way on the way in.
 */
public class TraceHeaderCodec {

    private static final Logger logger = LoggerFactory.getLogger(TraceHeaderCodec.class);

    /**
     * @return the remote context described by the headers, or null when neither
     * x-trace-id nor traceparent is present
     */
    @Nullable
    public TraceContext extract(@Nullable Map<String, ?> headers) {
        if (headers == null || headers.isEmpty()) {
            return null;
        }

        String traceId = headerValue(headers, TraceHeaders.TRACE_ID);
        if (traceId == null) {
            traceId = headerValue(headers, TraceHeaders.TRACEPARENT);
        }
        if (traceId == null) {
            return null;
        }

        String traceName = headerValue(headers, TraceHeaders.TRACE_NAME);

        return TraceContext.builder()
                .traceId(traceId)
                .spanId(headerValue(headers, TraceHeaders.SPAN_ID))
                .traceName(traceName != null ? traceName : TraceHeaders.DEFAULT_REMOTE_TRACE_NAME)
                .baggage(parseBaggage(headerValue(headers, TraceHeaders.BAGGAGE)))
                .remote(true)
                .build();
    }

    /**
     * @return headers for an outgoing request, empty when context is null
     */
    public Map<String, String> inject(@Nullable TraceContext context) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (context == null) {
            return headers;
        }

        headers.put(TraceHeaders.TRACE_ID, context.getTraceId());
        headers.put(TraceHeaders.TRACE_NAME, context.getTraceName());
        if (StringUtils.hasText(context.getSpanId())) {
            headers.put(TraceHeaders.SPAN_ID, context.getSpanId());
        }
        if (!context.getBaggage().isEmpty()) {
            headers.put(TraceHeaders.BAGGAGE, formatBaggage(context.getBaggage()));
        }
        return headers;
    }

    Map<String, String> parseBaggage(@Nullable String header) {
        Map<String, String> baggage = new LinkedHashMap<>();
        if (!StringUtils.hasText(header)) {
            return baggage;
        }

        for (String item : header.split(",")) {
            int separator = item.indexOf('=');
            if (separator < 0) {
                continue;
            }
            String key = item.substring(0, separator).trim();
            String value = item.substring(separator + 1).trim();
            if (key.isEmpty() || value.isEmpty()) {
                continue;
            }
            baggage.put(key, decode(key, value));
        }
        return baggage;
    }

    String formatBaggage(Map<String, String> baggage) {
        StringJoiner joiner = new StringJoiner(",");
        baggage.forEach((key, value) ->
                joiner.add(key + "=" + UriUtils.encode(value, StandardCharsets.UTF_8)));
        return joiner.toString();
    }

    private String decode(String key, String value) {
        try {
            return UriUtils.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            logger.debug("baggage item {} is not valid percent-encoding, keeping raw value", key);
            return value;
        }
    }

    @Nullable
    private static String headerValue(Map<String, ?> headers, String name) {
        Object raw = headers.get(name);
        if (raw == null) {
            for (Map.Entry<String, ?> entry : headers.entrySet()) {
                if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
                    raw = entry.getValue();
                    break;
                }
            }
        }

        String value = firstValue(raw);
        return StringUtils.hasText(value) ? value : null;
    }

    @Nullable
    private static String firstValue(@Nullable Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof String s) {
            return s;
        }
        if (raw instanceof String[] values) {
            return values.length > 0 ? values[0] : null;
        }
        if (raw instanceof Collection<?> values) {
            Iterator<?> it = values.iterator();
            return it.hasNext() ? firstValue(it.next()) : null;
        }
        return raw.toString();
    }
}
