package com.fuzzy.reconciliation.blocking;

import com.fuzzy.reconciliation.assignment.StateCorruptionException;
import com.fuzzy.reconciliation.core.model.CandidatePair;
import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.core.model.RecordKey;
import com.fuzzy.reconciliation.core.model.Side;
import com.fuzzy.reconciliation.core.model.SourceRecord;
import com.fuzzy.reconciliation.incremental.BatchTransaction;
import com.fuzzy.reconciliation.incremental.ReconciliationState;
import com.fuzzy.reconciliation.metrics.MetricsService;
import com.fuzzy.reconciliation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maintains the blocking indexes and turns record insertions and removals into candidate
 * pair deltas.
 *
 * <p>On insertion the record is filed under its index keys, its probe keys are looked up in
 * the opposite side's index, and every co-located record becomes a candidate. Co-located
 * records are ranked by the number of keys they share with the new record (then by id) and
 * only the top {@code maxCandidatesPerRecord} are scored; truncation is logged as a degraded
 * match and never fails the batch.</p>
 *
 * <p>The cap holds on both endpoints: an existing record whose candidate degree already
 * reached the cap is skipped, so no record ever has more than {@code maxCandidatesPerRecord}
 * candidate edges.</p>
 */
public class CandidateGenerator {
    private static final Logger log = LoggerFactory.getLogger(CandidateGenerator.class);

    private final List<BlockingKeyExtractor> extractors;
    private final PairScoringService scoring;
    private final int maxCandidatesPerRecord;
    private final MetricsService metrics;

    public CandidateGenerator(List<BlockingKeyExtractor> extractors, PairScoringService scoring,
                              int maxCandidatesPerRecord) {
        this(extractors, scoring, maxCandidatesPerRecord, new NoOpMetricsService());
    }

    public CandidateGenerator(List<BlockingKeyExtractor> extractors, PairScoringService scoring,
                              int maxCandidatesPerRecord, MetricsService metrics) {
        if (extractors == null || extractors.isEmpty()) {
            throw new IllegalArgumentException("At least one blocking key extractor is required");
        }
        if (maxCandidatesPerRecord <= 0) {
            throw new IllegalArgumentException("maxCandidatesPerRecord must be positive");
        }
        this.extractors = List.copyOf(extractors);
        this.scoring = scoring;
        this.maxCandidatesPerRecord = maxCandidatesPerRecord;
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    /**
     * Indexes a newly active record and scores it against co-located opposite records.
     * The scored pairs are added to the state's candidate graph.
     */
    public CandidateDelta onInsert(ReconciliationState state, SourceRecord record, BatchTransaction tx) {
        Side side = record.side();
        Set<String> indexKeys = new TreeSet<>();
        Set<String> probeKeys = new TreeSet<>();
        for (BlockingKeyExtractor extractor : extractors) {
            indexKeys.addAll(extractor.indexKeys(side, record.fields()));
            probeKeys.addAll(extractor.probeKeys(side, record.fields()));
        }
        state.index(record.key(), indexKeys, tx);

        List<RecordId> colocated = withSpareCapacity(state, side.opposite(),
                rankColocated(state.index(side.opposite()), probeKeys), record);
        if (colocated.size() > maxCandidatesPerRecord) {
            metrics.incrementFanOutExceeded();
            log.warn("candidate.fanout.exceeded side={} id={} colocated={} cap={}",
                    side, record.id(), colocated.size(), maxCandidatesPerRecord);
            colocated = colocated.subList(0, maxCandidatesPerRecord);
        }

        List<SourceRecord> opposites = new ArrayList<>(colocated.size());
        for (RecordId id : colocated) {
            RecordKey key = new RecordKey(side.opposite(), id);
            opposites.add(state.record(key).orElseThrow(() ->
                    new StateCorruptionException("Blocking index references inactive record " + key)));
        }

        List<CandidatePair> pairs = scoring.scoreAll(record, opposites);
        for (CandidatePair pair : pairs) {
            state.addCandidate(pair, tx);
        }
        log.debug("Record {} indexed under {} keys, {} co-located, {} candidates",
                record.key(), indexKeys.size(), opposites.size(), pairs.size());
        return CandidateDelta.added(pairs);
    }

    /**
     * Purges a record from its index and drops every candidate pair involving it, without
     * re-scoring anything.
     */
    public CandidateDelta onRemove(ReconciliationState state, RecordKey key, BatchTransaction tx) {
        state.unindex(key, tx);
        List<CandidatePair> dropped = state.removeCandidates(key, tx);
        log.debug("Record {} unindexed, {} candidates dropped", key, dropped.size());
        return CandidateDelta.removed(dropped);
    }

    public List<BlockingKeyExtractor> getExtractors() {
        return extractors;
    }

    public int getMaxCandidatesPerRecord() {
        return maxCandidatesPerRecord;
    }

    private List<RecordId> withSpareCapacity(ReconciliationState state, Side opposite,
                                             List<RecordId> ranked, SourceRecord record) {
        List<RecordId> open = new ArrayList<>(ranked.size());
        for (RecordId id : ranked) {
            if (state.graph().degree(new RecordKey(opposite, id)) < maxCandidatesPerRecord) {
                open.add(id);
            }
        }
        int saturated = ranked.size() - open.size();
        if (saturated > 0) {
            metrics.incrementFanOutExceeded();
            log.warn("candidate.fanout.saturated side={} id={} skipped={} cap={}",
                    record.side(), record.id(), saturated, maxCandidatesPerRecord);
        }
        return open;
    }

    private static List<RecordId> rankColocated(BlockingIndex opposite, Set<String> probeKeys) {
        Map<RecordId, Integer> sharedKeys = new HashMap<>();
        for (String key : probeKeys) {
            for (RecordId id : opposite.lookup(key)) {
                sharedKeys.merge(id, 1, Integer::sum);
            }
        }
        List<Map.Entry<RecordId, Integer>> ranked = new ArrayList<>(sharedKeys.entrySet());
        ranked.sort(Map.Entry.<RecordId, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.<RecordId, Integer>comparingByKey()));
        List<RecordId> ids = new ArrayList<>(ranked.size());
        for (Map.Entry<RecordId, Integer> entry : ranked) {
            ids.add(entry.getKey());
        }
        return ids;
    }
}
