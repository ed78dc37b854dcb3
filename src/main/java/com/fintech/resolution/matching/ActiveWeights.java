package com.fintech.resolution.matching;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Weights actually applied to one query: the configured weights of the
 * dimensions the query carries, rescaled to sum to 1. Absent dimensions get
 * weight 0 and do not contribute to the composite score.
 */
public final class ActiveWeights {

    private static final double SUM_TOLERANCE = 1e-9;

    private final Map<ScoreDimension, Double> weights;

    private ActiveWeights(Map<ScoreDimension, Double> weights) {
        this.weights = Collections.unmodifiableMap(weights);
    }

    public static ActiveWeights of(ScoreWeights configured, Set<ScoreDimension> present) {
        if (present.isEmpty()) {
            throw new IllegalArgumentException("At least one dimension must be present");
        }
        double total = 0;
        for (ScoreDimension dimension : present) {
            total += configured.weightOf(dimension);
        }
        EnumMap<ScoreDimension, Double> normalized = new EnumMap<>(ScoreDimension.class);
        for (ScoreDimension dimension : present) {
            normalized.put(dimension, configured.weightOf(dimension) / total);
        }
        ActiveWeights active = new ActiveWeights(normalized);
        if (Math.abs(active.sum() - 1.0) > SUM_TOLERANCE) {
            throw new IllegalStateException("Active weights sum to " + active.sum());
        }
        return active;
    }

    public boolean isActive(ScoreDimension dimension) {
        return weights.containsKey(dimension);
    }

    public double weightOf(ScoreDimension dimension) {
        return weights.getOrDefault(dimension, 0.0);
    }

    public double sum() {
        double sum = 0;
        for (double weight : weights.values()) {
            sum += weight;
        }
        return sum;
    }

    /**
     * Weighted sum of the given per-dimension scores, clamped to [0, 1].
     * Scores for inactive dimensions are ignored.
     */
    public double combine(Map<ScoreDimension, Double> scores) {
        double composite = 0;
        for (Map.Entry<ScoreDimension, Double> entry : weights.entrySet()) {
            composite += entry.getValue() * scores.getOrDefault(entry.getKey(), 0.0);
        }
        return Math.max(0.0, Math.min(1.0, composite));
    }
}
