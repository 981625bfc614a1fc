package com.fuzzy.reconciliation.api;

import com.fuzzy.reconciliation.assignment.AssignmentSolver;
import com.fuzzy.reconciliation.assignment.GreedyAssignmentSolver;
import com.fuzzy.reconciliation.assignment.Match;
import com.fuzzy.reconciliation.blocking.BlockingKeyExtractor;
import com.fuzzy.reconciliation.blocking.CandidateGenerator;
import com.fuzzy.reconciliation.blocking.PairScoringService;
import com.fuzzy.reconciliation.cache.CacheConfig;
import com.fuzzy.reconciliation.cache.CacheStats;
import com.fuzzy.reconciliation.cache.CaffeineScoreCache;
import com.fuzzy.reconciliation.cache.CachingSimilarityScorer;
import com.fuzzy.reconciliation.cache.NoOpScoreCache;
import com.fuzzy.reconciliation.cache.ScoreCache;
import com.fuzzy.reconciliation.core.model.DeltaEvent;
import com.fuzzy.reconciliation.core.model.DeltaOp;
import com.fuzzy.reconciliation.core.model.RecordId;
import com.fuzzy.reconciliation.core.model.Side;
import com.fuzzy.reconciliation.incremental.AssignmentDiff;
import com.fuzzy.reconciliation.incremental.BatchRejectedException;
import com.fuzzy.reconciliation.incremental.IncrementalMaintainer;
import com.fuzzy.reconciliation.incremental.ReconciliationState;
import com.fuzzy.reconciliation.incremental.RecordDelta;
import com.fuzzy.reconciliation.metrics.MetricsService;
import com.fuzzy.reconciliation.metrics.NoOpMetricsService;
import com.fuzzy.reconciliation.output.OutputEvent;
import com.fuzzy.reconciliation.output.OutputRow;
import com.fuzzy.reconciliation.output.OutputSink;
import com.fuzzy.reconciliation.output.ResultMaterializer;
import com.fuzzy.reconciliation.rules.FieldNormalizer;
import com.fuzzy.reconciliation.rules.FieldSchema;
import com.fuzzy.reconciliation.similarity.AggregationMode;
import com.fuzzy.reconciliation.similarity.FieldRule;
import com.fuzzy.reconciliation.similarity.SimilarityScorer;
import com.fuzzy.reconciliation.similarity.WeightedFieldScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Main entry point for incremental reconciliation.
 *
 * <p>Usage:</p>
 * <pre>
 * try (ReconciliationEngine engine = ReconciliationEngine.builder()
 *         .blocking(new NumericBucketKey("amount", 10))
 *         .fieldRule(FieldRule.required("amount", new NumericToleranceComparator(5), 3.0))
 *         .sink((batchId, events) -> ...)
 *         .build()) {
 *     BatchOutcome outcome = engine.apply(List.of(
 *             DeltaEvent.insert(Side.LEFT, "0", Map.of("amount", "8946"))));
 * }
 * </pre>
 *
 * <p>Raw events are normalized outside the state lock; batches are then applied one at a
 * time in the order they acquire the lock. Each committed batch is published to the sinks
 * before the next one starts.</p>
 */
public class ReconciliationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final ReconciliationOptions options;
    private final FieldNormalizer normalizer;
    private final PairScoringService scoringService;
    private final IncrementalMaintainer maintainer;
    private final ResultMaterializer materializer;
    private final List<OutputSink> sinks;
    private final ScoreCache scoreCache;
    private final MetricsService metricsService;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean closed;

    private ReconciliationEngine(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.normalizer = new FieldNormalizer(builder.leftSchema, builder.rightSchema);

        SimilarityScorer scorer = builder.scorer != null
                ? builder.scorer : new WeightedFieldScorer(builder.fieldRules, builder.aggregationMode);

        CacheConfig cacheConfig = options.getCacheConfig();
        if (builder.scoreCache != null) {
            this.scoreCache = builder.scoreCache;
        } else if (cacheConfig.enabled()) {
            this.scoreCache = new CaffeineScoreCache(cacheConfig);
        } else {
            this.scoreCache = new NoOpScoreCache();
        }
        if (!(scoreCache instanceof NoOpScoreCache)) {
            scorer = new CachingSimilarityScorer(scorer, scoreCache, metricsService);
        }

        this.scoringService = new PairScoringService(scorer, options.getScoringThreads(), metricsService);
        CandidateGenerator generator = new CandidateGenerator(builder.extractors, scoringService,
                options.getMaxCandidatesPerRecord(), metricsService);
        AssignmentSolver solver = builder.solver != null ? builder.solver : new GreedyAssignmentSolver();

        this.maintainer = new IncrementalMaintainer(new ReconciliationState(), generator, solver,
                options.getThreshold(), options.isVerifyFullStateEachBatch(), metricsService);
        this.materializer = new ResultMaterializer();
        this.sinks = List.copyOf(builder.sinks);

        log.info("ReconciliationEngine initialized: {} extractors, {} sinks, {}",
                builder.extractors.size(), sinks.size(), options);
    }

    // ========== Batch API ==========

    /**
     * Applies a batch of raw delta events and publishes the resulting output events.
     *
     * @return the committed outcome
     * @throws BatchRejectedException if the batch was rejected; the prior state remains authoritative
     * @throws IllegalArgumentException if the batch exceeds {@link ReconciliationOptions#getMaxBatchSize()}
     */
    public BatchOutcome apply(List<DeltaEvent> events) {
        Objects.requireNonNull(events, "events is required");
        ensureOpen();
        if (events.size() > options.getMaxBatchSize()) {
            throw new IllegalArgumentException("Batch of " + events.size()
                    + " events exceeds maxBatchSize " + options.getMaxBatchSize());
        }

        List<RecordDelta> deltas = new ArrayList<>(events.size());
        for (DeltaEvent event : events) {
            deltas.add(event.op() == DeltaOp.INSERT
                    ? RecordDelta.insert(normalizer.normalize(event))
                    : RecordDelta.remove(event.key()));
        }

        lock.lock();
        try {
            ensureOpen();
            List<OutputEvent> output = new ArrayList<>();
            AssignmentDiff diff = maintainer.apply(deltas, committed -> output.addAll(materializer.apply(committed)));
            List<String> sinkErrors = publish(diff.batchId(), output);
            return new BatchOutcome(diff.batchId(), diff, output, sinkErrors);
        } finally {
            lock.unlock();
        }
    }

    public BatchOutcome insert(Side side, String id, Map<String, String> fields) {
        return apply(List.of(DeltaEvent.insert(side, id, fields)));
    }

    public BatchOutcome remove(Side side, String id) {
        return apply(List.of(DeltaEvent.remove(side, id)));
    }

    // ========== Views ==========

    /**
     * Left-join view: one row per active left record, in left-id order.
     */
    public List<OutputRow> currentResults() {
        lock.lock();
        try {
            return materializer.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public Optional<OutputRow> resultFor(String leftId) {
        lock.lock();
        try {
            return materializer.row(RecordId.of(leftId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of the current matches keyed by left id.
     */
    public Map<RecordId, Match> assignmentSnapshot() {
        lock.lock();
        try {
            return new TreeMap<>(maintainer.getState().assignment().matchesByLeft());
        } finally {
            lock.unlock();
        }
    }

    public int activeCount(Side side) {
        lock.lock();
        try {
            return maintainer.getState().activeCount(side);
        } finally {
            lock.unlock();
        }
    }

    public CacheStats getCacheStats() {
        return scoreCache.getStats();
    }

    public ReconciliationOptions getOptions() {
        return options;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    /**
     * Creates an {@link AsyncReconciliationEngine} that submits batches to this engine
     * from a single worker thread.
     */
    public AsyncReconciliationEngine async() {
        return new AsyncReconciliationEngine(this, options.getAsyncTimeoutMs());
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            scoringService.close();
            scoreCache.invalidateAll();
            log.info("ReconciliationEngine closed");
        } finally {
            lock.unlock();
        }
    }

    private List<String> publish(String batchId, List<OutputEvent> output) {
        List<String> errors = new ArrayList<>();
        for (OutputSink sink : sinks) {
            try {
                sink.onBatch(batchId, output);
            } catch (RuntimeException e) {
                log.error("sink.failed batchId={} sink={} reason={}",
                        batchId, sink.getClass().getSimpleName(), e.getMessage(), e);
                errors.add(sink.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
        return errors;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("ReconciliationEngine is closed");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReconciliationOptions options = ReconciliationOptions.defaults();
        private FieldSchema leftSchema = FieldSchema.untyped();
        private FieldSchema rightSchema = FieldSchema.untyped();
        private final List<BlockingKeyExtractor> extractors = new ArrayList<>();
        private final List<FieldRule> fieldRules = new ArrayList<>();
        private AggregationMode aggregationMode = AggregationMode.WEIGHTED_AVERAGE;
        private SimilarityScorer scorer;
        private AssignmentSolver solver;
        private MetricsService metricsService;
        private ScoreCache scoreCache;
        private final List<OutputSink> sinks = new ArrayList<>();

        public Builder options(ReconciliationOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder leftSchema(FieldSchema leftSchema) {
            this.leftSchema = Objects.requireNonNull(leftSchema, "leftSchema is required");
            return this;
        }

        public Builder rightSchema(FieldSchema rightSchema) {
            this.rightSchema = Objects.requireNonNull(rightSchema, "rightSchema is required");
            return this;
        }

        /**
         * Adds blocking key extractors, consulted in the order given.
         */
        public Builder blocking(BlockingKeyExtractor... extractors) {
            for (BlockingKeyExtractor extractor : extractors) {
                this.extractors.add(Objects.requireNonNull(extractor, "extractor is required"));
            }
            return this;
        }

        public Builder fieldRule(FieldRule rule) {
            this.fieldRules.add(Objects.requireNonNull(rule, "rule is required"));
            return this;
        }

        public Builder fieldRules(List<FieldRule> rules) {
            rules.forEach(this::fieldRule);
            return this;
        }

        public Builder aggregationMode(AggregationMode aggregationMode) {
            this.aggregationMode = Objects.requireNonNull(aggregationMode, "aggregationMode is required");
            return this;
        }

        /**
         * Sets a custom scorer. When set, field rules and aggregation mode are ignored.
         */
        public Builder scorer(SimilarityScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        public Builder solver(AssignmentSolver solver) {
            this.solver = solver;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets a custom score cache. Overrides {@link ReconciliationOptions#getCacheConfig()}.
         */
        public Builder scoreCache(ScoreCache scoreCache) {
            this.scoreCache = scoreCache;
            return this;
        }

        public Builder sink(OutputSink sink) {
            this.sinks.add(Objects.requireNonNull(sink, "sink is required"));
            return this;
        }

        public ReconciliationEngine build() {
            if (extractors.isEmpty()) {
                throw new IllegalStateException("At least one blocking key extractor is required");
            }
            if (scorer == null && fieldRules.isEmpty()) {
                throw new IllegalStateException("Either field rules or a custom scorer is required");
            }
            return new ReconciliationEngine(this);
        }
    }
}
