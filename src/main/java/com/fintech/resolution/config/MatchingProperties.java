package com.fintech.resolution.config;

import com.fintech.resolution.matching.RankingParameters;
import com.fintech.resolution.matching.ScoreWeights;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tolerances and ranking policy for fuzzy transaction matching.
 */
@ConfigurationProperties(prefix = "resolution.matching")
@NoArgsConstructor
@Getter
@Setter
public class MatchingProperties {

    /** Allowed deviation of a transaction amount from the queried amount, in percent. Default 10. */
    private double amountTolerancePercent = 10.0;

    /** Allowed distance between queried and booked date, in days. Default 3. */
    private int dateToleranceDays = 3;

    /** Candidates with a composite score below this are dropped. Default 0.5. */
    private double acceptanceThreshold = 0.5;

    /** Minimum lead of the best candidate over the runner-up to call the match unique. Default 0.05. */
    private double ambiguityEpsilon = 0.05;

    /** Maximum candidates returned. Default 5. */
    private int maxCandidates = 5;

    /** Score for a substring-only merchant match; 0 disables the fallback. Default 0.5. */
    private double partialMerchantScore = 0.5;

    private Weights weights = new Weights();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Weights {
        private double amount = 0.15;
        private double date = 0.25;
        private double merchant = 0.60;
    }

    public RankingParameters toRankingParameters() {
        return RankingParameters.builder()
                .amountTolerancePercent(amountTolerancePercent)
                .dateToleranceDays(dateToleranceDays)
                .acceptanceThreshold(acceptanceThreshold)
                .ambiguityEpsilon(ambiguityEpsilon)
                .maxCandidates(maxCandidates)
                .partialMerchantScore(partialMerchantScore)
                .weights(new ScoreWeights(weights.getAmount(), weights.getDate(), weights.getMerchant()))
                .build();
    }
}
