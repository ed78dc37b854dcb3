package com.fintech.resolution.matching;

import com.fintech.resolution.dto.MatchCandidate;
import com.fintech.resolution.entity.Transaction;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Candidates a session is waiting for the user to choose between.
 * Immutable; a new turn replaces the instance held for the session.
 */
@Value
@Builder
public class PendingDisambiguation {

    String sessionId;
    String userId;
    String queryFingerprint;
    List<MatchCandidate> candidates;
    Instant createdAt;

    @With
    int turnsElapsed;

    /**
     * @param rank 1-based
     */
    public Optional<MatchCandidate> candidateAt(int rank) {
        if (rank < 1 || rank > candidates.size()) {
            return Optional.empty();
        }
        return Optional.of(candidates.get(rank - 1));
    }

    public Optional<MatchCandidate> candidateFor(String transactionId) {
        return candidates.stream()
                .filter(c -> c.getTransaction().getId().equals(transactionId))
                .findFirst();
    }

    public List<Transaction> transactions() {
        List<Transaction> transactions = new ArrayList<>(candidates.size());
        for (MatchCandidate candidate : candidates) {
            transactions.add(candidate.getTransaction());
        }
        return transactions;
    }

    public boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(createdAt.plus(ttl));
    }
}
