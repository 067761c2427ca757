package net.coachtrace.Tracing.Annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Records every call of a Spring bean method as a trace.
 *
 * The method runs inside the trace's context, so spans and outgoing headers created
 * during the call belong to it. The trace ends when the method returns, or when the
 * returned CompletionStage completes.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface TracedOperation {

    /** Trace name. Default: SimpleClassName.methodName */
    String value() default "";

    /** Tags attached to the trace. */
    String[] tags() default {};
}
