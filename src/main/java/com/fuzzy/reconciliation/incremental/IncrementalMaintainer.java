package com.fuzzy.reconciliation.incremental;

import com.fuzzy.reconciliation.assignment.AssignmentSolver;
import com.fuzzy.reconciliation.assignment.Match;
import com.fuzzy.reconciliation.assignment.SolveRequest;
import com.fuzzy.reconciliation.blocking.CandidateGenerator;
import com.fuzzy.reconciliation.core.model.CandidatePair;
import com.fuzzy.reconciliation.core.model.DeltaOp;
import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.core.model.RecordKey;
import com.fuzzy.reconciliation.core.model.Side;
import com.fuzzy.reconciliation.core.model.SourceRecord;
import com.fuzzy.reconciliation.logging.LogContext;
import com.fuzzy.reconciliation.metrics.MetricsService;
import com.fuzzy.reconciliation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Applies batches of record deltas to the {@link ReconciliationState} and reports the
 * resulting assignment changes.
 *
 * <p>For each batch:</p>
 * <ol>
 *   <li>deltas are applied in arrival order: inserts index and score the record, removals
 *       drop its candidates and free its partner;</li>
 *   <li>the affected region is built from the inserted records and freed partners, their
 *       one-hop candidate neighbours, and the current partners of all of those;</li>
 *   <li>matches inside the region are released and the solver runs once over edges whose
 *       endpoints are in the region or unmatched;</li>
 *   <li>touched slots are verified and compared with their value before the batch.</li>
 * </ol>
 * Matches outside the region are never read for writing, so they cannot change.
 *
 * <p>A batch is all-or-nothing: any failure, including a detected invariant violation,
 * rolls the state back and surfaces as {@link BatchRejectedException}. Not thread-safe;
 * callers serialize batches.</p>
 */
public class IncrementalMaintainer {
    private static final Logger log = LoggerFactory.getLogger(IncrementalMaintainer.class);

    private final ReconciliationState state;
    private final CandidateGenerator generator;
    private final AssignmentSolver solver;
    private final double threshold;
    private final boolean verifyFullState;
    private final MetricsService metrics;
    private final AtomicLong batchSequence = new AtomicLong();

    public IncrementalMaintainer(ReconciliationState state, CandidateGenerator generator,
                                 AssignmentSolver solver, double threshold) {
        this(state, generator, solver, threshold, false, new NoOpMetricsService());
    }

    public IncrementalMaintainer(ReconciliationState state, CandidateGenerator generator,
                                 AssignmentSolver solver, double threshold,
                                 boolean verifyFullState, MetricsService metrics) {
        this.state = Objects.requireNonNull(state, "state is required");
        this.generator = Objects.requireNonNull(generator, "generator is required");
        this.solver = Objects.requireNonNull(solver, "solver is required");
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        this.threshold = threshold;
        this.verifyFullState = verifyFullState;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    /**
     * Applies one batch.
     *
     * @return the assignment changes, grouped by left id in ascending order
     * @throws BatchRejectedException if the batch could not be applied; the state is unchanged
     */
    public AssignmentDiff apply(List<RecordDelta> batch) {
        return apply(batch, diff -> { });
    }

    /**
     * Applies one batch and hands the diff to {@code beforeCommit} while the batch is still
     * open. If the callback throws, the batch is rolled back and rejected like any other
     * failure.
     *
     * @throws BatchRejectedException if the batch or the callback failed; the state is unchanged
     */
    public AssignmentDiff apply(List<RecordDelta> batch, Consumer<AssignmentDiff> beforeCommit) {
        Objects.requireNonNull(beforeCommit, "beforeCommit is required");
        String batchId = "batch-" + batchSequence.incrementAndGet();
        long started = System.nanoTime();

        try (LogContext ctx = LogContext.forBatch(batchId).with("events", Integer.toString(batch.size()))) {
            BatchWork work = new BatchWork();
            AssignmentDiff diff;
            try (BatchTransaction tx = new BatchTransaction(batchId)) {
                for (RecordDelta delta : batch) {
                    if (delta.op() == DeltaOp.INSERT) {
                        applyInsert(delta.record(), work, tx);
                    } else {
                        applyRemove(delta.key(), work, tx);
                    }
                }
                resolveRegion(work, tx);
                state.verify(work.verifyKeys());
                if (verifyFullState) {
                    state.verifyAll();
                }
                diff = buildDiff(batchId, work);
                beforeCommit.accept(diff);
                tx.markSuccess();
            } catch (RuntimeException e) {
                metrics.incrementBatchRejected();
                metrics.recordBatchDuration(Duration.ofNanos(System.nanoTime() - started), false);
                log.error("batch.rejected batchId={} events={} reason={}", batchId, batch.size(), e.getMessage(), e);
                throw new BatchRejectedException(batchId, "Batch " + batchId + " rejected: " + e.getMessage(), e);
            }

            metrics.recordBatchSize(batch.size());
            metrics.recordRegionSize(work.regionSize);
            metrics.incrementPairsAdded((int) diff.count(AssignmentChange.Type.PAIR_ADDED));
            metrics.incrementPairsRemoved((int) diff.count(AssignmentChange.Type.PAIR_REMOVED));
            metrics.recordBatchDuration(Duration.ofNanos(System.nanoTime() - started), true);
            log.info("batch.applied batchId={} events={} region={} changes={}",
                    batchId, batch.size(), work.regionSize, diff.changes().size());
            return diff;
        }
    }

    public ReconciliationState getState() {
        return state;
    }

    public double getThreshold() {
        return threshold;
    }

    private void applyInsert(SourceRecord record, BatchWork work, BatchTransaction tx) {
        RecordKey key = record.key();
        Optional<SourceRecord> existing = state.record(key);
        if (existing.isPresent()) {
            if (existing.get().fields().equals(record.fields())) {
                log.debug("record.duplicate key={} - insert ignored", key);
                return;
            }
            log.debug("record.replaced key={}", key);
            applyRemove(key, work, tx);
        }

        if (key.side() == Side.LEFT) {
            work.touch(key.id());
        }
        state.putRecord(record, tx);
        generator.onInsert(state, record, tx);
        work.seeds.add(key);
    }

    private void applyRemove(RecordKey key, BatchWork work, BatchTransaction tx) {
        if (!state.isActive(key)) {
            log.debug("record.remove.ignored key={} lifecycle={}", key, state.lifecycle(key));
            return;
        }
        if (key.side() == Side.LEFT) {
            work.touch(key.id());
        }
        Optional<RecordKey> partner = state.assignment().partnerOf(key);
        if (partner.isPresent()) {
            RecordId leftId = key.side() == Side.LEFT ? key.id() : partner.get().id();
            work.touch(leftId);
            state.unmatch(leftId, tx);
            work.seeds.add(partner.get());
        }
        generator.onRemove(state, key, tx);
        state.removeRecord(key, tx);
        work.seeds.remove(key);
    }

    private void resolveRegion(BatchWork work, BatchTransaction tx) {
        Set<RecordKey> region = new TreeSet<>();
        for (RecordKey seed : work.seeds) {
            if (state.isActive(seed)) {
                region.add(seed);
                region.addAll(state.graph().neighbours(seed));
            }
        }
        for (RecordKey key : new ArrayList<>(region)) {
            state.assignment().partnerOf(key).ifPresent(region::add);
        }
        work.regionSize = region.size();
        work.region.addAll(region);
        if (region.isEmpty()) {
            return;
        }

        for (RecordKey key : region) {
            if (key.side() == Side.LEFT && state.assignment().isMatched(key)) {
                work.touch(key.id());
                state.unmatch(key.id(), tx);
            }
        }

        Set<CandidatePair> edges = new LinkedHashSet<>();
        for (RecordKey key : region) {
            for (CandidatePair edge : state.graph().edgesOf(key)) {
                RecordKey other = key.side() == Side.LEFT
                        ? RecordKey.right(edge.rightId())
                        : RecordKey.left(edge.leftId());
                if (region.contains(other) || !state.assignment().isMatched(other)) {
                    edges.add(edge);
                }
            }
        }

        List<CandidatePair> accepted = solver.solve(SolveRequest.of(edges, threshold));
        for (CandidatePair pair : accepted) {
            work.touch(pair.leftId());
            work.region.add(RecordKey.right(pair.rightId()));
            state.match(Match.of(pair), tx);
            metrics.recordMatchConfidence(pair.score());
        }
        log.debug("Region of {} records re-solved over {} edges, {} pairs accepted",
                region.size(), edges.size(), accepted.size());
    }

    private AssignmentDiff buildDiff(String batchId, BatchWork work) {
        List<AssignmentChange> changes = new ArrayList<>();
        for (Map.Entry<RecordId, Slot> entry : work.before.entrySet()) {
            RecordId leftId = entry.getKey();
            Slot before = entry.getValue();
            Slot after = currentSlot(leftId);

            if (!before.active() && after.active()) {
                changes.add(AssignmentChange.leftAdded(leftId));
                if (after.match() != null) {
                    changes.add(AssignmentChange.pairAdded(leftId, after.match().rightId(), after.match().confidence()));
                }
            } else if (before.active() && !after.active()) {
                if (before.match() != null) {
                    changes.add(AssignmentChange.pairRemoved(leftId, before.match().rightId(),
                            before.match().confidence()));
                }
                changes.add(AssignmentChange.leftRemoved(leftId));
            } else if (before.active() && !Objects.equals(before.match(), after.match())) {
                Match old = before.match();
                Match now = after.match();
                if (old != null && now != null && old.rightId().equals(now.rightId())) {
                    changes.add(AssignmentChange.confidenceChanged(leftId, now.rightId(),
                            old.confidence(), now.confidence()));
                    continue;
                }
                if (old != null) {
                    changes.add(AssignmentChange.pairRemoved(leftId, old.rightId(), old.confidence()));
                }
                if (now != null) {
                    changes.add(AssignmentChange.pairAdded(leftId, now.rightId(), now.confidence()));
                }
            }
        }
        return new AssignmentDiff(batchId, changes);
    }

    private Slot currentSlot(RecordId leftId) {
        RecordKey key = RecordKey.left(leftId);
        return new Slot(state.isActive(key), state.assignment().matchOf(key).orElse(null));
    }

    /**
     * State of a left slot: whether the record is active and its match, if any.
     */
    private record Slot(boolean active, Match match) {}

    /**
     * Book-keeping for one batch.
     */
    private final class BatchWork {
        private final Map<RecordId, Slot> before = new TreeMap<>();
        private final Set<RecordKey> seeds = new TreeSet<>();
        private final Set<RecordKey> region = new TreeSet<>();
        private int regionSize;

        void touch(RecordId leftId) {
            before.computeIfAbsent(leftId, IncrementalMaintainer.this::currentSlot);
        }

        Set<RecordKey> verifyKeys() {
            Set<RecordKey> keys = new TreeSet<>(region);
            for (RecordId leftId : before.keySet()) {
                keys.add(RecordKey.left(leftId));
            }
            return keys;
        }
    }
}
