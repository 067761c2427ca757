package net.coachtrace.Tracing.Aspect;

import net.coachtrace.Tracing.Annotations.TracedOperation;
import net.coachtrace.Tracing.Context.TraceContextStore;
import net.coachtrace.Tracing.Context.TraceScope;
import net.coachtrace.Tracing.Model.Trace;
import net.coachtrace.Tracing.Model.TraceContext;
import net.coachtrace.Tracing.Model.TraceOutcome;
import net.coachtrace.Tracing.Model.TraceRequest;
import net.coachtrace.Tracing.TracingService;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Wraps methods annotated with {@link TracedOperation} in a trace.
 * Exceptions thrown by the method are rethrown unchanged.
 */
@Aspect
public class TracedOperationAspect {

    private static final Logger logger = LoggerFactory.getLogger(TracedOperationAspect.class);

    private final TracingService tracingService;
    private final TraceContextStore contextStore;

    public TracedOperationAspect(TracingService tracingService, TraceContextStore contextStore) {
        this.tracingService = tracingService;
        this.contextStore = contextStore;
    }

    @Around("@annotation(tracedOperation)")
    public Object traceOperation(ProceedingJoinPoint pjp, TracedOperation tracedOperation) throws Throwable {
        MethodSignature signature = (MethodSignature) pjp.getSignature();
        String className = signature.getDeclaringType().getSimpleName();
        String methodName = signature.getName();
        String traceName = tracedOperation.value().isEmpty()
                ? className + "." + methodName
                : tracedOperation.value();

        Map<String, Object> input = new LinkedHashMap<>();
        input.put("class", signature.getDeclaringTypeName());
        input.put("method", methodName);

        Trace trace = tracingService.createTrace(TraceRequest.builder()
                .name(traceName)
                .input(input)
                .tags(Arrays.asList(tracedOperation.tags()))
                .build());

        if (trace == null) {
            return pjp.proceed();
        }

        Object result;
        try (TraceScope ignored = contextStore.openScope(TraceContext.of(trace))) {
            result = pjp.proceed();
        } catch (Throwable t) {
            tracingService.endTrace(trace, TraceOutcome.failure(describe(t)));
            throw t;
        }

        if (result instanceof CompletionStage<?> stage) {
            stage.whenComplete((value, error) -> tracingService.endTrace(trace, error == null
                    ? TraceOutcome.success()
                    : TraceOutcome.failure(describe(unwrap(error)))));
            logger.debug("trace {} will end when {} completes", trace.getTraceId(), traceName);
            return result;
        }

        tracingService.endTrace(trace, TraceOutcome.success());
        return result;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
