package net.coachtrace.Tracing.Headers;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import net.coachtrace.Tracing.Context.TraceContextStore;
import net.coachtrace.Tracing.Context.TraceScope;
import net.coachtrace.Tracing.Model.TraceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts the caller's trace context from inbound HTTP headers and runs the rest of
 * the filter chain with it as the current context. Requests without trace headers
 * pass through untouched.
 *
 * While the request is handled the remote trace id is also exposed to log patterns
 * as the MDC key "traceId".
 */
public class TraceContextFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(TraceContextFilter.class);
    static final String MDC_TRACE_ID = "traceId";

    private final TraceHeaderCodec codec;
    private final TraceContextStore contextStore;

    public TraceContextFilter(TraceHeaderCodec codec, TraceContextStore contextStore) {
        this.codec = codec;
        this.contextStore = contextStore;
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return true;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        TraceContext context = codec.extract(collectHeaders(request));
        if (context == null) {
            filterChain.doFilter(request, response);
            return;
        }

        logger.debug("{} {} joined remote trace {} ({})", request.getMethod(), request.getRequestURI(),
                context.getTraceId(), context.getTraceName());

        String previousTraceId = MDC.get(MDC_TRACE_ID);
        MDC.put(MDC_TRACE_ID, context.getTraceId());
        try (TraceScope ignored = contextStore.openScope(context)) {
            filterChain.doFilter(request, response);
        } finally {
            if (previousTraceId != null) {
                MDC.put(MDC_TRACE_ID, previousTraceId);
            } else {
                MDC.remove(MDC_TRACE_ID);
            }
        }
    }

    private static Map<String, List<String>> collectHeaders(HttpServletRequest request) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        if (request.getHeaderNames() == null) {
            return headers;
        }
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, new ArrayList<>(Collections.list(request.getHeaders(name))));
        }
        return headers;
    }
}
