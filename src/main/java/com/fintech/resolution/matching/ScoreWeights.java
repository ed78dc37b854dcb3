package com.fintech.resolution.matching;

import lombok.Value;

/**
 * Configured relative importance of each dimension, before redistribution.
 * Only the ratios matter; {@link ActiveWeights} normalizes them per query.
 */
@Value
public class ScoreWeights {

    double amount;
    double date;
    double merchant;

    public ScoreWeights(double amount, double date, double merchant) {
        if (amount <= 0 || date <= 0 || merchant <= 0) {
            throw new IllegalArgumentException("Score weights must be positive");
        }
        this.amount = amount;
        this.date = date;
        this.merchant = merchant;
    }

    public double weightOf(ScoreDimension dimension) {
        return switch (dimension) {
            case AMOUNT -> amount;
            case DATE -> date;
            case MERCHANT -> merchant;
        };
    }
}
