package com.fintech.resolution.dto;

import com.fintech.resolution.entity.Merchant;
import com.fintech.resolution.entity.Transaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * What the conversation layer needs to ask the user to pick a candidate.
 * Wording is up to the caller; this only carries the ordered choices and
 * the short reference the user can answer with.
 */
@Value
@Builder
public class ClarificationRequest {

    String sessionId;
    List<CandidateSummary> candidates;

    @Value
    @Builder
    public static class CandidateSummary {
        /** 1-based rank, usable as {@link Selection#byRank(int)}. */
        int reference;
        String transactionId;
        BigDecimal amount;
        String currency;
        LocalDate date;
        String merchantName;
        double score;
    }

    public static ClarificationRequest of(String sessionId, List<MatchCandidate> candidates,
                                          Map<String, Merchant> merchantsById) {
        List<CandidateSummary> summaries = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            MatchCandidate candidate = candidates.get(i);
            Transaction txn = candidate.getTransaction();
            Merchant merchant = merchantsById.get(txn.getMerchantId());
            summaries.add(CandidateSummary.builder()
                    .reference(i + 1)
                    .transactionId(txn.getId())
                    .amount(txn.getAmount())
                    .currency(txn.getCurrency())
                    .date(txn.getTransactionDate())
                    .merchantName(merchant != null ? merchant.getCanonicalName() : txn.getMerchantId())
                    .score(candidate.getCompositeScore())
                    .build());
        }
        return new ClarificationRequest(sessionId, List.copyOf(summaries));
    }
}
