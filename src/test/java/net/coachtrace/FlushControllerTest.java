package net.coachtrace;

import net.coachtrace.Tracing.Backend.TracingBackendClient;
import net.coachtrace.Tracing.Exceptions.FlushException;
import net.coachtrace.Tracing.Flush.BackoffCalculator;
import net.coachtrace.Tracing.Flush.FlushController;
import net.coachtrace.Tracing.Flush.RetryPolicy;
import net.coachtrace.Tracing.Metrics.TracingMetricsRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FlushControllerTest {

    @Mock
    private TracingBackendClient client;

    @Mock
    private TracingMetricsRecorder metricsRecorder;

    private ThreadPoolTaskScheduler scheduler;
    private FlushController flushController;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("flush-test-");
        scheduler.initialize();
        flushController = new FlushController(scheduler, new BackoffCalculator(() -> 0.0), metricsRecorder);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void testFlush_SucceedsOnThirdAttempt() throws Exception {
        // Given
        when(client.flush()).thenReturn(
                CompletableFuture.failedFuture(new IllegalStateException("backend unavailable")),
                CompletableFuture.failedFuture(new IllegalStateException("backend unavailable")),
                CompletableFuture.completedFuture(null));

        RetryPolicy policy = new RetryPolicy(3, 10, 1000, true, true);

        // When
        flushController.flush(client, policy).get(5, TimeUnit.SECONDS);

        // Then
        verify(client, times(3)).flush();
        verify(metricsRecorder, times(2)).recordFlushAttempt(eq(false), anyLong());
        verify(metricsRecorder).recordFlushAttempt(eq(true), anyLong());
    }

    @Test
    void testFlush_SucceedsFirstTimeWithoutRetry() throws Exception {
        when(client.flush()).thenReturn(CompletableFuture.completedFuture(null));

        flushController.flush(client, new RetryPolicy(3, 10, 1000, false, true)).get(1, TimeUnit.SECONDS);

        verify(client, times(1)).flush();
    }

    @Test
    void testFlush_TimeoutWithThrowOnErrorFails() {
        // Given - the backend never answers
        when(client.flush()).thenReturn(new CompletableFuture<>());
        RetryPolicy policy = new RetryPolicy(1, 10, 50, true, true);

        // When
        CompletableFuture<Void> result = flushController.flush(client, policy);

        // Then
        ExecutionException e = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        FlushException flushException = assertInstanceOf(FlushException.class, e.getCause());
        assertEquals(1, flushException.getAttempts());
        assertInstanceOf(TimeoutException.class, flushException.getCause());
    }

    @Test
    void testFlush_AllAttemptsFailButErrorsSwallowedByDefault() throws Exception {
        // Given
        when(client.flush()).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));
        RetryPolicy policy = new RetryPolicy(2, 10, 1000, false, false);

        // When
        flushController.flush(client, policy).get(5, TimeUnit.SECONDS);

        // Then
        verify(client, times(2)).flush();
    }

    @Test
    void testFlush_TimeoutDoesNotCancelBackendCall() {
        // Given
        CompletableFuture<Void> inFlight = new CompletableFuture<>();
        when(client.flush()).thenReturn(inFlight);

        // When
        CompletableFuture<Void> result = flushController.flush(client, new RetryPolicy(1, 10, 50, false, true));

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(result::isDone);
        assertFalse(result.isCompletedExceptionally());
        assertFalse(inFlight.isDone(), "Backend call should be left running after a timeout");
        verify(metricsRecorder).recordFlushAttempt(eq(false), anyLong());
    }

    @Test
    void testFlush_RetriesRunOnScheduler() {
        when(client.flush())
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")))
                .thenReturn(CompletableFuture.completedFuture(null));

        flushController.flush(client, new RetryPolicy(3, 20, 1000, false, false));

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> verify(client, times(2)).flush());
    }

    @Test
    void testFlush_SynchronousThrowCountsAsFailedAttempt() {
        when(client.flush()).thenThrow(new IllegalStateException("sync failure"));
        RetryPolicy policy = new RetryPolicy(2, 10, 1000, true, true);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> flushController.flush(client, policy).get(5, TimeUnit.SECONDS));

        FlushException flushException = assertInstanceOf(FlushException.class, e.getCause());
        assertEquals(2, flushException.getAttempts());
        assertEquals("sync failure", flushException.getCause().getMessage());
        verify(client, times(2)).flush();
    }

    @Test
    void testFlush_SchedulesRetryWithBackoffDelay() {
        // Given
        TaskScheduler taskScheduler = mock(TaskScheduler.class);
        FlushController controller = new FlushController(taskScheduler, new BackoffCalculator(() -> 0.0), metricsRecorder);
        when(client.flush()).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("down")));

        // When
        controller.flush(client, new RetryPolicy(3, 1000, 5000, false, true));

        // Then
        ArgumentCaptor<Instant> instantCaptor = ArgumentCaptor.forClass(Instant.class);
        verify(taskScheduler).schedule(any(Runnable.class), instantCaptor.capture());

        long delayMs = instantCaptor.getValue().toEpochMilli() - Instant.now().toEpochMilli();
        assertTrue(delayMs >= 900 && delayMs <= 1100, "Delay should be around 1000ms, was: " + delayMs);
    }
}
