package com.fintech.resolution.matching;

import com.fintech.resolution.dto.MatchCandidate;
import com.fintech.resolution.dto.MatchOutcome;
import com.fintech.resolution.dto.MatchQuery;
import com.fintech.resolution.dto.MatchResult;
import com.fintech.resolution.entity.Merchant;
import com.fintech.resolution.entity.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Ranks a user's transactions against a query and classifies the result as
 * unique, ambiguous or empty.
 * <p>
 * Pure: reads the snapshot it is given and never touches session state, so
 * concurrent sessions can rank in parallel without locking.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransactionRanker {

    static final Comparator<MatchCandidate> RANKING_ORDER = Comparator
            .comparingDouble(MatchCandidate::getCompositeScore).reversed()
            .thenComparing(c -> c.getTransaction().getTransactionDate(), Comparator.reverseOrder())
            .thenComparing(c -> c.getTransaction().getId());

    private final MatchScorer scorer;

    /**
     * @param snapshot      transactions of one user
     * @param merchantsById merchant catalog; transactions with an unknown merchant score 0 on that dimension
     */
    public MatchResult rank(MatchQuery query, Collection<Transaction> snapshot,
                            Map<String, Merchant> merchantsById, RankingParameters params) {
        query.validate();
        params.validate();

        if (query.hasTransactionId()) {
            String id = query.getTransactionId().trim();
            return snapshot.stream()
                    .filter(txn -> txn.getId().equals(id))
                    .findFirst()
                    .map(txn -> MatchResult.unique(MatchCandidate.exact(txn)))
                    .orElseGet(MatchResult::empty);
        }

        ActiveWeights weights = ActiveWeights.of(params.getWeights(), query.presentDimensions());
        List<MatchCandidate> accepted = new ArrayList<>();
        for (Transaction txn : snapshot) {
            if (!passesFilters(query, txn)) {
                continue;
            }
            MatchCandidate candidate = scorer.score(query, txn, merchantsById.get(txn.getMerchantId()), weights, params);
            if (candidate.getCompositeScore() >= params.getAcceptanceThreshold()) {
                accepted.add(candidate);
            }
        }

        accepted.sort(RANKING_ORDER);
        List<MatchCandidate> top = accepted.size() > params.getMaxCandidates()
                ? accepted.subList(0, params.getMaxCandidates())
                : accepted;

        MatchResult result = classify(top, params.getAmbiguityEpsilon());
        log.debug("Ranked {} transactions: {} accepted, outcome {}", snapshot.size(), accepted.size(), result.getOutcome());
        return result;
    }

    static MatchResult classify(List<MatchCandidate> ranked, double epsilon) {
        if (ranked.isEmpty()) {
            return MatchResult.empty();
        }
        if (ranked.size() == 1) {
            return MatchResult.ranked(MatchOutcome.UNIQUE, ranked);
        }
        double gap = ranked.get(0).getCompositeScore() - ranked.get(1).getCompositeScore();
        return MatchResult.ranked(gap > epsilon ? MatchOutcome.UNIQUE : MatchOutcome.AMBIGUOUS, ranked);
    }

    private static boolean passesFilters(MatchQuery query, Transaction txn) {
        if (query.getCategory() != null && !query.getCategory().isBlank()
                && !query.getCategory().trim().equalsIgnoreCase(txn.getCategory())) {
            return false;
        }
        return query.getStatus() == null || query.getStatus() == txn.getStatus();
    }
}
