package com.fintech.resolution.matching;

import lombok.Builder;
import lombok.Value;

/**
 * Tolerances and cut-offs for one ranking run.
 */
@Value
@Builder(toBuilder = true)
public class RankingParameters {

    double amountTolerancePercent;
    int dateToleranceDays;
    double acceptanceThreshold;
    double ambiguityEpsilon;
    int maxCandidates;
    double partialMerchantScore;
    ScoreWeights weights;

    public void validate() {
        if (amountTolerancePercent <= 0) {
            throw new IllegalArgumentException("amountTolerancePercent must be positive");
        }
        if (dateToleranceDays < 0) {
            throw new IllegalArgumentException("dateToleranceDays must not be negative");
        }
        if (acceptanceThreshold < 0 || acceptanceThreshold > 1) {
            throw new IllegalArgumentException("acceptanceThreshold must be within [0, 1]");
        }
        if (ambiguityEpsilon < 0) {
            throw new IllegalArgumentException("ambiguityEpsilon must not be negative");
        }
        if (maxCandidates < 1) {
            throw new IllegalArgumentException("maxCandidates must be at least 1");
        }
        if (partialMerchantScore < 0 || partialMerchantScore > 1) {
            throw new IllegalArgumentException("partialMerchantScore must be within [0, 1]");
        }
        if (weights == null) {
            throw new IllegalArgumentException("weights must be provided");
        }
    }
}
