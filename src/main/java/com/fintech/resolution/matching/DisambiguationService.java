package com.fintech.resolution.matching;

import com.fintech.resolution.config.DisambiguationProperties;
import com.fintech.resolution.dto.MatchCandidate;
import com.fintech.resolution.dto.MatchQuery;
import com.fintech.resolution.dto.MatchResult;
import com.fintech.resolution.dto.Selection;
import com.fintech.resolution.entity.Merchant;
import com.fintech.resolution.exception.InvalidQueryException;
import com.fintech.resolution.exception.StaleReferenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-session clarification state: {@code IDLE -> AWAITING_CLARIFICATION -> IDLE}.
 * <p>
 * A session's turns arrive one at a time, so an entry is only ever changed by
 * its own session. The map is concurrent because different sessions and the
 * expiry sweeper touch it in parallel; removals are conditional on the exact
 * instance so the sweeper never drops a state a session has just replaced.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DisambiguationService {

    private final ConcurrentMap<String, PendingDisambiguation> pending = new ConcurrentHashMap<>();

    private final TransactionRanker ranker;
    private final DisambiguationProperties properties;
    private final Clock clock;

    /**
     * Stores the candidates of an ambiguous result for the session, replacing any earlier state.
     */
    public PendingDisambiguation open(String sessionId, String userId, String queryFingerprint, MatchResult result) {
        if (!result.isAmbiguous()) {
            throw new IllegalArgumentException("Only an ambiguous result needs clarification, got " + result.getOutcome());
        }
        PendingDisambiguation state = PendingDisambiguation.builder()
                .sessionId(sessionId)
                .userId(userId)
                .queryFingerprint(queryFingerprint)
                .candidates(result.getCandidates())
                .createdAt(clock.instant())
                .turnsElapsed(0)
                .build();
        PendingDisambiguation previous = pending.put(sessionId, state);
        log.info("Session {} awaiting clarification between {} candidates{}", sessionId,
                result.getCandidates().size(), previous != null ? " (replaced earlier clarification)" : "");
        return state;
    }

    public void discard(String sessionId) {
        if (pending.remove(sessionId) != null) {
            log.info("Session {} clarification discarded", sessionId);
        }
    }

    public Optional<PendingDisambiguation> current(String sessionId) {
        PendingDisambiguation state = pending.get(sessionId);
        if (state == null) {
            return Optional.empty();
        }
        if (state.isExpired(clock.instant(), properties.getTtl())) {
            expire(state, "ttl elapsed");
            return Optional.empty();
        }
        return Optional.of(state);
    }

    public DisambiguationState stateOf(String sessionId) {
        return current(sessionId).isPresent() ? DisambiguationState.AWAITING_CLARIFICATION : DisambiguationState.IDLE;
    }

    /**
     * Applies the user's answer to the session's pending clarification.
     * <ul>
     *   <li>a rank or transaction id resolves to that candidate and clears the state;</li>
     *   <li>a refined query re-ranks only the pending candidates: a unique or empty
     *       outcome clears the state, an ambiguous one narrows it.</li>
     * </ul>
     *
     * @throws StaleReferenceException if nothing is pending for this session and user
     * @throws InvalidQueryException   if the rank or transaction id is not one of the candidates;
     *                                 the pending state is kept so the user can answer again
     */
    public MatchResult select(String sessionId, String userId, Selection selection,
                              RankingParameters params, Map<String, Merchant> merchantsById) {
        PendingDisambiguation state = current(sessionId)
                .filter(s -> s.getUserId().equals(userId))
                .orElseThrow(() -> new StaleReferenceException(sessionId));

        switch (selection.getType()) {
            case RANK: {
                MatchCandidate chosen = state.candidateAt(selection.getRank())
                        .orElseThrow(() -> new InvalidQueryException("Reference " + selection.getRank()
                                + " is not between 1 and " + state.getCandidates().size()));
                return resolve(state, chosen);
            }
            case TRANSACTION_ID: {
                MatchCandidate chosen = state.candidateFor(selection.getTransactionId())
                        .orElseThrow(() -> new InvalidQueryException(
                                "Transaction " + selection.getTransactionId() + " is not one of the offered candidates"));
                return resolve(state, chosen);
            }
            case REFINED_QUERY:
                return refine(state, selection.getRefinedQuery(), params, merchantsById);
            default:
                throw new IllegalStateException("Unknown selection type: " + selection.getType());
        }
    }

    /**
     * Counts a turn that did not answer the clarification. The state expires once
     * it has been left unanswered for the configured number of turns.
     */
    public void advanceTurn(String sessionId) {
        current(sessionId).ifPresent(state -> {
            PendingDisambiguation next = state.withTurnsElapsed(state.getTurnsElapsed() + 1);
            if (next.getTurnsElapsed() >= properties.getMaxTurns()) {
                expire(state, "unanswered for " + next.getTurnsElapsed() + " turn(s)");
            } else {
                pending.replace(sessionId, state, next);
            }
        });
    }

    /**
     * Drops every clarification past its TTL.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (PendingDisambiguation state : pending.values()) {
            if (state.isExpired(now, properties.getTtl()) && pending.remove(state.getSessionId(), state)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Purged {} expired clarification(s)", removed);
        }
        return removed;
    }

    public int pendingCount() {
        return pending.size();
    }

    private MatchResult resolve(PendingDisambiguation state, MatchCandidate chosen) {
        pending.remove(state.getSessionId(), state);
        log.info("Session {} clarification resolved", state.getSessionId());
        return MatchResult.unique(chosen);
    }

    private MatchResult refine(PendingDisambiguation state, MatchQuery refined,
                               RankingParameters params, Map<String, Merchant> merchantsById) {
        if (refined == null) {
            throw new InvalidQueryException("Refined query is missing");
        }
        MatchResult result = ranker.rank(refined, state.transactions(), merchantsById, params);
        switch (result.getOutcome()) {
            case AMBIGUOUS:
                PendingDisambiguation narrowed = PendingDisambiguation.builder()
                        .sessionId(state.getSessionId())
                        .userId(state.getUserId())
                        .queryFingerprint(refined.fingerprint())
                        .candidates(result.getCandidates())
                        .createdAt(clock.instant())
                        .turnsElapsed(0)
                        .build();
                pending.replace(state.getSessionId(), state, narrowed);
                log.info("Session {} clarification narrowed from {} to {} candidates", state.getSessionId(),
                        state.getCandidates().size(), narrowed.getCandidates().size());
                break;
            case UNIQUE:
                pending.remove(state.getSessionId(), state);
                log.info("Session {} clarification resolved by refined query", state.getSessionId());
                break;
            default:
                pending.remove(state.getSessionId(), state);
                log.info("Session {} refined query matched none of the candidates", state.getSessionId());
                break;
        }
        return result;
    }

    private void expire(PendingDisambiguation state, String reason) {
        if (pending.remove(state.getSessionId(), state)) {
            log.info("Session {} clarification expired: {}", state.getSessionId(), reason);
        }
    }
}
