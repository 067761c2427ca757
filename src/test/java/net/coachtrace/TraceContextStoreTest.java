package net.coachtrace;

import net.coachtrace.Tracing.Context.TraceContextStore;
import net.coachtrace.Tracing.Context.TraceScope;
import net.coachtrace.Tracing.Model.TraceContext;
import net.coachtrace.Tracing.Model.TraceLinkOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextStoreTest {

    private TraceContextStore store;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        store = new TraceContextStore();
        pool = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void testGetContext_NullOutsideScope() {
        assertNull(store.getContext());
    }

    @Test
    void testRunWithContext_ConcurrentOperationsStayIsolated() throws Exception {
        // Given
        TraceContext a = context("trace-a");
        TraceContext b = context("trace-b");
        List<String> seenByA = Collections.synchronizedList(new ArrayList<>());
        List<String> seenByB = Collections.synchronizedList(new ArrayList<>());

        // When - both chains hop threads and interleave through delays
        CompletableFuture<Void> runA = store.runWithContext(a, () -> chain(seenByA, 30));
        CompletableFuture<Void> runB = store.runWithContext(b, () -> chain(seenByB, 10));
        CompletableFuture.allOf(runA, runB).get(5, TimeUnit.SECONDS);

        // Then
        assertEquals(List.of("trace-a", "trace-a", "trace-a", "trace-a"), seenByA);
        assertEquals(List.of("trace-b", "trace-b", "trace-b", "trace-b"), seenByB);
        assertNull(store.getContext(), "Context should not leak to the caller");
    }

    private CompletableFuture<Void> chain(List<String> seen, long delayMs) {
        seen.add(currentTraceId());
        return CompletableFuture
                .runAsync(() -> seen.add(currentTraceId()), store.executor(pool))
                .thenRunAsync(() -> seen.add(currentTraceId()), store.delayedExecutor(delayMs, TimeUnit.MILLISECONDS))
                .thenRunAsync(() -> seen.add(currentTraceId()), store.executor(pool));
    }

    @Test
    void testRunWithContextSync_NestedScopeRestoresOuter() {
        TraceContext outer = context("outer");
        TraceContext inner = context("inner");

        String result = store.runWithContextSync(outer, () -> {
            String innerSeen = store.runWithContextSync(inner, this::currentTraceId);
            assertEquals("inner", innerSeen);
            return currentTraceId();
        });

        assertEquals("outer", result);
        assertNull(store.getContext());
    }

    @Test
    void testRunWithContextSync_RestoresContextWhenFnThrows() {
        TraceContext outer = context("outer");

        store.runWithContextSync(outer, () -> {
            assertThrows(IllegalStateException.class, () -> store.runWithContextSync(context("inner"), () -> {
                throw new IllegalStateException("boom");
            }));
            assertEquals("outer", currentTraceId());
            return null;
        });
    }

    @Test
    void testRunWithContext_SynchronousThrowBecomesFailedFuture() {
        CompletableFuture<String> future = store.runWithContext(context("t"), () -> {
            throw new IllegalArgumentException("bad input");
        });

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertNull(store.getContext());
    }

    @Test
    void testRunWithContext_NullStageCompletesWithNull() throws Exception {
        CompletableFuture<String> future = store.runWithContext(context("t"), () -> null);

        assertNull(future.get(1, TimeUnit.SECONDS));
    }

    @Test
    void testOpenScope_CloseRestoresPrevious() {
        try (TraceScope scope = store.openScope(context("scoped"))) {
            assertEquals("scoped", scope.getContext().getTraceId());
            assertEquals("scoped", currentTraceId());
        }
        assertNull(store.getContext());
    }

    @Test
    void testWrap_RunnableKeepsSubmitterContext() throws Exception {
        List<String> seen = Collections.synchronizedList(new ArrayList<>());

        Runnable task = store.runWithContextSync(context("wrapped"), () -> store.wrap(() -> {
            seen.add(currentTraceId());
        }));
        pool.submit(task).get(1, TimeUnit.SECONDS);

        assertEquals(List.of("wrapped"), seen);
    }

    @Test
    void testExecutorServiceAndSupplier_KeepSubmitterContext() throws Exception {
        ExecutorService wrapped = store.executorService(pool);

        Future<String> fromPool = store.runWithContextSync(context("service"),
                () -> wrapped.submit(this::currentTraceId));
        assertEquals("service", fromPool.get(1, TimeUnit.SECONDS));

        Supplier<String> supplier = store.runWithContextSync(context("supplier"),
                () -> store.wrapSupplier(this::currentTraceId));
        assertEquals("supplier", CompletableFuture.supplyAsync(supplier, pool).get(1, TimeUnit.SECONDS));
        assertNull(store.getContext());
    }

    @Test
    void testLinkToRemoteTrace_StoredInCurrentScope() {
        // outside a scope there is nothing to link
        assertFalse(store.linkToRemoteTrace("remote-1", null));
        assertNull(store.getCurrentLink());

        store.runWithContextSync(context("local"), () -> {
            assertTrue(store.linkToRemoteTrace("remote-1", TraceLinkOptions.builder()
                    .relationship("follows_from")
                    .remoteService("payments")
                    .build()));

            TraceLinkOptions link = store.getCurrentLink();
            assertNotNull(link);
            assertEquals("remote-1", link.getRemoteTraceId());
            assertEquals("follows_from", link.getRelationship());
            assertEquals("payments", link.getRemoteService());
            return null;
        });

        assertNull(store.getCurrentLink(), "Link should not outlive its scope");
    }

    private String currentTraceId() {
        TraceContext current = store.getContext();
        return current != null ? current.getTraceId() : null;
    }

    private static TraceContext context(String traceId) {
        return TraceContext.builder().traceId(traceId).traceName(traceId + "_name").build();
    }
}
