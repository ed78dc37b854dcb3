package com.fintech.resolution.matching;

import com.fintech.resolution.dto.MatchCandidate;
import com.fintech.resolution.dto.MatchQuery;
import com.fintech.resolution.entity.Merchant;
import com.fintech.resolution.entity.Transaction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-dimension similarity between a query and one transaction.
 * All scores are in [0, 1]; stateless and safe to share between threads.
 */
@Component
@RequiredArgsConstructor
public class MatchScorer {

    /** Smallest currency unit, so that a tiny queried amount still gets a usable band. */
    static final BigDecimal SMALLEST_UNIT = new BigDecimal("0.01");

    /**
     * Lowest score a value inside the tolerance band can get. Keeps a value sitting
     * exactly on the band edge distinguishable from one outside it.
     */
    static final double IN_TOLERANCE_FLOOR = 1e-9;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final MerchantResolver merchantResolver;

    public double scoreAmount(BigDecimal queryAmount, BigDecimal txnAmount, double tolerancePercent) {
        BigDecimal diff = queryAmount.subtract(txnAmount).abs();
        // Exact decimal band so an amount on the edge never rounds outside it
        BigDecimal band = queryAmount.max(SMALLEST_UNIT)
                .multiply(BigDecimal.valueOf(tolerancePercent))
                .divide(HUNDRED);
        if (diff.compareTo(band) > 0) {
            return 0.0;
        }
        if (diff.signum() == 0) {
            return 1.0;
        }
        double score = 1.0 - diff.doubleValue() / band.doubleValue();
        return clamp(score, IN_TOLERANCE_FLOOR);
    }

    public double scoreDate(LocalDate queryDate, LocalDate txnDate, int toleranceDays) {
        long days = Math.abs(ChronoUnit.DAYS.between(queryDate, txnDate));
        if (days > toleranceDays) {
            return 0.0;
        }
        if (days == 0) {
            return 1.0;
        }
        return clamp(1.0 - (double) days / toleranceDays, IN_TOLERANCE_FLOOR);
    }

    /**
     * @param merchant the transaction's merchant, null if it is missing from the catalog
     */
    public double scoreMerchant(String queryText, Merchant merchant, double partialScore) {
        if (queryText == null || queryText.isBlank()) {
            return 1.0;
        }
        return switch (merchantResolver.matchType(queryText, merchant)) {
            case CANONICAL_NAME, ALIAS -> 1.0;
            case PARTIAL -> partialScore;
            case NONE -> 0.0;
        };
    }

    public MatchCandidate score(MatchQuery query, Transaction txn, Merchant merchant,
                                ActiveWeights weights, RankingParameters params) {
        Map<ScoreDimension, Double> scores = new EnumMap<>(ScoreDimension.class);
        scores.put(ScoreDimension.AMOUNT, weights.isActive(ScoreDimension.AMOUNT)
                ? scoreAmount(query.getAmount(), txn.getAmount(), params.getAmountTolerancePercent())
                : 1.0);
        scores.put(ScoreDimension.DATE, weights.isActive(ScoreDimension.DATE)
                ? scoreDate(query.getDate(), txn.getTransactionDate(), params.getDateToleranceDays())
                : 1.0);
        scores.put(ScoreDimension.MERCHANT, weights.isActive(ScoreDimension.MERCHANT)
                ? scoreMerchant(query.getMerchantText(), merchant, params.getPartialMerchantScore())
                : 1.0);

        return MatchCandidate.builder()
                .transaction(txn)
                .amountScore(scores.get(ScoreDimension.AMOUNT))
                .dateScore(scores.get(ScoreDimension.DATE))
                .merchantScore(scores.get(ScoreDimension.MERCHANT))
                .compositeScore(weights.combine(scores))
                .build();
    }

    private static double clamp(double score, double floor) {
        return Math.max(floor, Math.min(1.0, score));
    }
}
