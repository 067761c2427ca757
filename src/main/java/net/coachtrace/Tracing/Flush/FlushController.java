package net.coachtrace.Tracing.Flush;

import net.coachtrace.Tracing.Backend.TracingBackendClient;
import net.coachtrace.Tracing.Exceptions.FlushException;
import net.coachtrace.Tracing.Metrics.TracingMetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drains buffered telemetry to the backend with bounded retries.
 *
 * Each attempt is raced against the policy timeout. A timed out attempt counts as a
 * failure but the backend call itself is left running. Waits between attempts are
 * scheduled on the TaskScheduler so no thread blocks while backing off.
 */
public class FlushController {

    private static final Logger logger = LoggerFactory.getLogger(FlushController.class);

    private final TaskScheduler taskScheduler;
    private final BackoffCalculator backoffCalculator;
    private final TracingMetricsRecorder metricsRecorder;

    public FlushController(TaskScheduler taskScheduler,
                           BackoffCalculator backoffCalculator,
                           TracingMetricsRecorder metricsRecorder) {
        this.taskScheduler = taskScheduler;
        this.backoffCalculator = backoffCalculator;
        this.metricsRecorder = metricsRecorder;
    }

    /**
     * @return a future completing once an attempt succeeded or all attempts failed.
     * It only completes exceptionally, with a FlushException, when the policy asks for it.
     */
    public CompletableFuture<Void> flush(TracingBackendClient client, RetryPolicy policy) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        attempt(client, policy, 1, result);
        return result;
    }

    private void attempt(TracingBackendClient client, RetryPolicy policy, int attempt, CompletableFuture<Void> result) {
        long startTime = System.currentTimeMillis();

        startFlush(client)
                .orTimeout(policy.getTimeoutMs(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> {
                    if (error == null) {
                        metricsRecorder.recordFlushAttempt(true, startTime);
                        logger.debug("flush attempt {}/{} succeeded", attempt, policy.getRetryAttempts());
                        result.complete(null);
                        return;
                    }

                    Throwable cause = unwrap(error);
                    metricsRecorder.recordFlushAttempt(false, startTime);
                    logger.warn("flush attempt {}/{} failed: {}", attempt, policy.getRetryAttempts(), describe(cause, policy));

                    if (attempt >= policy.getRetryAttempts()) {
                        giveUp(policy, attempt, cause, result);
                        return;
                    }

                    long delay = backoffCalculator.calculateDelay(policy, attempt);
                    try {
                        taskScheduler.schedule(() -> attempt(client, policy, attempt + 1, result),
                                Instant.now().plusMillis(delay));
                        logger.debug("scheduled flush attempt {} in {}ms", attempt + 1, delay);
                    } catch (RuntimeException e) {
                        logger.error("failed to schedule flush retry: {}", e.getMessage());
                        giveUp(policy, attempt, cause, result);
                    }
                });
    }

    // orTimeout is applied to a copy, the backend future itself is never completed here
    private CompletableFuture<Void> startFlush(TracingBackendClient client) {
        try {
            CompletableFuture<Void> call = client.flush();
            if (call == null) {
                return CompletableFuture.completedFuture(null);
            }
            return call.copy();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void giveUp(RetryPolicy policy, int attempts, Throwable cause, CompletableFuture<Void> result) {
        logger.error("failed to flush traces after {} attempts: {}", attempts, describe(cause, policy));
        if (policy.isThrowOnError()) {
            result.completeExceptionally(new FlushException(attempts, cause));
        } else {
            result.complete(null);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause, RetryPolicy policy) {
        if (cause instanceof TimeoutException) {
            return "timed out after " + policy.getTimeoutMs() + "ms";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
