package com.fuzzy.reconciliation.api;

import com.fuzzy.reconciliation.blocking.NumericBucketKey;
import com.fuzzy.reconciliation.core.model.DeltaEvent;
import com.fuzzy.reconciliation.core.model.FieldKind;
import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.core.model.Side;
import com.fuzzy.reconciliation.incremental.BatchRejectedException;
import com.fuzzy.reconciliation.rules.FieldSchema;
import com.fuzzy.reconciliation.similarity.FieldRule;
import com.fuzzy.reconciliation.similarity.NumericToleranceComparator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class AsyncReconciliationEngineTest {

    private ReconciliationEngine engine;

    private static ReconciliationEngine.Builder engineBuilder() {
        FieldSchema schema = FieldSchema.builder().requiredField("amount", FieldKind.NUMBER).build();
        return ReconciliationEngine.builder()
                .leftSchema(schema)
                .rightSchema(schema)
                .blocking(new NumericBucketKey("amount", 100))
                .fieldRule(FieldRule.required("amount", new NumericToleranceComparator(100), 1.0));
    }

    @BeforeEach
    void setUp() {
        engine = engineBuilder().build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("Should create async engine via factory method")
    void testAsyncFactory() {
        AsyncReconciliationEngine async = engine.async();
        assertEquals(30_000, async.getTimeoutMs());
        async.close();
    }

    @Test
    @DisplayName("Should apply batch asynchronously")
    void testSubmit() throws Exception {
        try (AsyncReconciliationEngine async = engine.async()) {
            CompletableFuture<BatchOutcome> future = async.submit(List.of(
                    DeltaEvent.insert(Side.LEFT, "0", Map.of("amount", "8946")),
                    DeltaEvent.insert(Side.RIGHT, "1", Map.of("amount", "8946"))));

            BatchOutcome outcome = future.get(10, TimeUnit.SECONDS);
            assertEquals("batch-1", outcome.batchId());
            assertEquals(RecordId.of(1), engine.resultFor("0").orElseThrow().rightId());
        }
    }

    @Test
    @DisplayName("Batches are applied in submission order")
    void testSubmissionOrder() throws Exception {
        try (AsyncReconciliationEngine async = engine.async()) {
            List<CompletableFuture<BatchOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                futures.add(async.submit(List.of(
                        DeltaEvent.insert(Side.LEFT, Integer.toString(i), Map.of("amount", "100")))));
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals("batch-" + (i + 1), futures.get(i).get(10, TimeUnit.SECONDS).batchId());
            }
        }
        assertEquals(20, engine.activeCount(Side.LEFT));
    }

    @Test
    @DisplayName("Rejected batch completes the future exceptionally")
    void testRejectedBatch() {
        try (ReconciliationEngine rejecting = engineBuilder()
                .solver(request -> {
                    throw new IllegalStateException("solver down");
                })
                .build();
             AsyncReconciliationEngine async = rejecting.async()) {

            CompletableFuture<BatchOutcome> future = async.submit(List.of(
                    DeltaEvent.insert(Side.LEFT, "0", Map.of("amount", "100")),
                    DeltaEvent.insert(Side.RIGHT, "0", Map.of("amount", "100"))));

            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
            assertInstanceOf(BatchRejectedException.class, e.getCause());
        }
    }

    @Test
    @DisplayName("Slow batch times out without being cancelled")
    void testTimeout() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        try (ReconciliationEngine slow = engineBuilder()
                .sink((batchId, events) -> {
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                })
                .build()) {
            AsyncReconciliationEngine async = new AsyncReconciliationEngine(slow, 50);

            CompletableFuture<BatchOutcome> future = async.submit(List.of(
                    DeltaEvent.insert(Side.LEFT, "0", Map.of("amount", "100"))));

            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
            assertInstanceOf(TimeoutException.class, e.getCause());

            release.countDown();
            async.close();
            assertEquals(1, slow.activeCount(Side.LEFT));
        }
    }

    @Test
    @DisplayName("Closed async engine refuses new batches but leaves the engine open")
    void testSubmitAfterClose() {
        AsyncReconciliationEngine async = engine.async();
        async.close();

        CompletableFuture<BatchOutcome> future = async.submit(List.of());
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());

        assertDoesNotThrow(() -> engine.apply(List.of()));
    }

    @Test
    void testTimeoutValidation() {
        assertThrows(IllegalArgumentException.class, () -> new AsyncReconciliationEngine(engine, 0));
    }
}
