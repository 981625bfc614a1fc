package com.fuzzy.reconciliation.similarity;

import com.fuzzy.reconciliation.core.model.FieldBag;
import com.fuzzy.reconciliation.core.model.FieldValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores a pair by running one {@link FieldComparator} per configured field and
 * aggregating the results according to an {@link AggregationMode}.
 *
 * <p>Formula for {@link AggregationMode#WEIGHTED_AVERAGE}:
 * {@code score = Σ wᵢ·sᵢ / Σ wᵢ}. A field missing on exactly one side contributes its
 * rule's {@code missingScore}; a field absent on both sides is left out of the sum, weight
 * included. A pair with no comparable field at all scores 0. A malformed value on either
 * side raises {@link MalformedRecordException}.</p>
 */
public class WeightedFieldScorer implements SimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(WeightedFieldScorer.class);

    private final List<FieldRule> rules;
    private final AggregationMode mode;

    public WeightedFieldScorer(List<FieldRule> rules) {
        this(rules, AggregationMode.WEIGHTED_AVERAGE);
    }

    public WeightedFieldScorer(List<FieldRule> rules, AggregationMode mode) {
        Objects.requireNonNull(rules, "rules is required");
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("At least one field rule is required");
        }
        this.rules = List.copyOf(rules);
        this.mode = Objects.requireNonNull(mode, "mode is required");
    }

    @Override
    public double score(FieldBag left, FieldBag right) {
        return computeWithBreakdown(left, right).score();
    }

    /**
     * Computes the confidence together with every per-field score.
     */
    public ScoreBreakdown computeWithBreakdown(FieldBag left, FieldBag right) {
        Map<String, Double> fieldScores = new LinkedHashMap<>();
        double weighted = 0.0;
        double totalWeight = 0.0;
        double requiredMin = 1.0;
        boolean anyRequired = false;

        for (FieldRule rule : rules) {
            if (!left.has(rule.leftField()) && !right.has(rule.rightField())) {
                continue;
            }
            double fieldScore = scoreField(rule, left, right);
            fieldScores.put(rule.leftField(), fieldScore);
            weighted += rule.weight() * fieldScore;
            totalWeight += rule.weight();
            if (rule.required()) {
                anyRequired = true;
                requiredMin = Math.min(requiredMin, fieldScore);
            }
        }

        double score;
        if (mode == AggregationMode.MIN_OVER_REQUIRED && anyRequired) {
            score = requiredMin;
        } else if (totalWeight > 0.0) {
            score = weighted / totalWeight;
        } else {
            score = 0.0;
        }
        score = Math.max(0.0, Math.min(1.0, score));

        if (log.isTraceEnabled()) {
            log.trace("Field scores {} -> {} ({})", fieldScores, score, mode);
        }
        return new ScoreBreakdown(score, fieldScores);
    }

    public List<FieldRule> getRules() {
        return rules;
    }

    public AggregationMode getMode() {
        return mode;
    }

    private static double scoreField(FieldRule rule, FieldBag left, FieldBag right) {
        Optional<FieldValue> l = left.get(rule.leftField());
        Optional<FieldValue> r = right.get(rule.rightField());
        if (l.isEmpty() || r.isEmpty()) {
            return rule.missingScore();
        }
        if (l.get().isMalformed() || r.get().isMalformed()) {
            throw new MalformedRecordException(rule.leftField(),
                    "Malformed value for field '" + rule.leftField() + "': "
                            + (l.get().isMalformed() ? l.get() : r.get()));
        }
        try {
            double s = rule.comparator().compare(l.get(), r.get());
            if (Double.isNaN(s) || s < 0.0 || s > 1.0) {
                throw new MalformedRecordException(rule.leftField(),
                        rule.comparator().getName() + " returned out-of-range score " + s);
            }
            return s;
        } catch (MalformedRecordException e) {
            if (e.getField() != null) {
                throw e;
            }
            throw new MalformedRecordException(rule.leftField(),
                    "Field '" + rule.leftField() + "': " + e.getMessage());
        }
    }

    /**
     * Confidence plus the individual field scores that produced it.
     */
    public record ScoreBreakdown(double score, Map<String, Double> fieldScores) {
        public ScoreBreakdown {
            fieldScores = Map.copyOf(fieldScores);
        }

        @Override
        public String toString() {
            return String.format("ScoreBreakdown{score=%.4f, fields=%s}", score, fieldScores);
        }
    }
}
