package com.fintech.resolution.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * The user's answer to a clarification: a transaction id, a rank number
 * from the clarification list, or a refined query.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Selection {

    public enum Type {
        TRANSACTION_ID,
        RANK,
        REFINED_QUERY
    }

    Type type;
    String transactionId;
    Integer rank;
    MatchQuery refinedQuery;

    public static Selection byTransactionId(String transactionId) {
        return new Selection(Type.TRANSACTION_ID, transactionId, null, null);
    }

    /**
     * @param rank 1-based position in the clarification list
     */
    public static Selection byRank(int rank) {
        return new Selection(Type.RANK, null, rank, null);
    }

    public static Selection refine(MatchQuery refinedQuery) {
        return new Selection(Type.REFINED_QUERY, null, null, refinedQuery);
    }
}
