package com.fintech.resolution.dto;

import com.fintech.resolution.entity.Transaction;
import lombok.Builder;
import lombok.Value;

/**
 * A transaction together with how well it matched a query.
 * Dimensions the query did not carry are reported as 1.0.
 */
@Value
@Builder
public class MatchCandidate {

    Transaction transaction;
    double amountScore;
    double dateScore;
    double merchantScore;
    double compositeScore;

    /**
     * Candidate for a transaction addressed by id, which bypasses scoring.
     */
    public static MatchCandidate exact(Transaction transaction) {
        return MatchCandidate.builder()
                .transaction(transaction)
                .amountScore(1.0)
                .dateScore(1.0)
                .merchantScore(1.0)
                .compositeScore(1.0)
                .build();
    }
}
