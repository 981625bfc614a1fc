package com.fuzzy.reconciliation.similarity;

/**
 * How per-field scores are combined into a pair confidence.
 */
public enum AggregationMode {
    /**
     * {@code Σ wᵢ·sᵢ / Σ wᵢ} over all configured fields.
     */
    WEIGHTED_AVERAGE,

    /**
     * Minimum over required fields; falls back to the weighted average when no
     * field is marked required.
     */
    MIN_OVER_REQUIRED
}
