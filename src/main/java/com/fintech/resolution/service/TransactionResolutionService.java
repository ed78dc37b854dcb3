package com.fintech.resolution.service;

import com.fintech.resolution.audit.AuditLogger;
import com.fintech.resolution.config.MatchingProperties;
import com.fintech.resolution.dto.ClarificationRequest;
import com.fintech.resolution.dto.MatchOutcome;
import com.fintech.resolution.dto.MatchQuery;
import com.fintech.resolution.dto.MatchResult;
import com.fintech.resolution.dto.ResolutionResponse;
import com.fintech.resolution.dto.Selection;
import com.fintech.resolution.entity.Merchant;
import com.fintech.resolution.entity.Transaction;
import com.fintech.resolution.exception.InvalidQueryException;
import com.fintech.resolution.exception.ResolutionException;
import com.fintech.resolution.matching.DisambiguationService;
import com.fintech.resolution.matching.DisambiguationState;
import com.fintech.resolution.matching.PendingDisambiguation;
import com.fintech.resolution.matching.RankingParameters;
import com.fintech.resolution.matching.TransactionRanker;
import com.fintech.resolution.repository.TransactionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for identifying the transaction a user is asking about.
 * <p>
 * Loads the user's transactions and the merchant catalog, ranks them against
 * the query and, when several transactions fit equally well, keeps the
 * candidates for the session until the user picks one.
 */
@Service
@Slf4j
public class TransactionResolutionService {

    private final TransactionRepository transactionRepository;
    private final MerchantService merchantService;
    private final TransactionRanker ranker;
    private final DisambiguationService disambiguation;
    private final MatchingProperties matchingProperties;
    private final AuditLogger auditLogger;
    private final MeterRegistry meterRegistry;

    // Metrics
    private final Map<MatchOutcome, Counter> outcomeCounters = new EnumMap<>(MatchOutcome.class);
    private Counter selectionResolvedCounter;
    private Counter selectionNarrowedCounter;
    private Counter selectionEmptyCounter;
    private Counter selectionRejectedCounter;

    public TransactionResolutionService(TransactionRepository transactionRepository,
                                        MerchantService merchantService,
                                        TransactionRanker ranker,
                                        DisambiguationService disambiguation,
                                        MatchingProperties matchingProperties,
                                        AuditLogger auditLogger,
                                        MeterRegistry meterRegistry) {
        this.transactionRepository = transactionRepository;
        this.merchantService = merchantService;
        this.ranker = ranker;
        this.disambiguation = disambiguation;
        this.matchingProperties = matchingProperties;
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        // Fail at startup rather than on the first query
        matchingProperties.toRankingParameters().validate();

        for (MatchOutcome outcome : MatchOutcome.values()) {
            outcomeCounters.put(outcome, Counter.builder("resolution.match.outcome")
                    .description("Match queries by outcome")
                    .tag("outcome", outcome.name())
                    .register(meterRegistry));
        }
        selectionResolvedCounter = selectionCounter("resolved");
        selectionNarrowedCounter = selectionCounter("narrowed");
        selectionEmptyCounter = selectionCounter("empty");
        selectionRejectedCounter = selectionCounter("rejected");
    }

    private Counter selectionCounter(String result) {
        return Counter.builder("resolution.selection")
                .description("Answers to clarification requests by result")
                .tag("result", result)
                .register(meterRegistry);
    }

    /**
     * Matches a fresh query for the session. Any clarification still pending for
     * the session belongs to an earlier query and is discarded first.
     */
    @Transactional(readOnly = true)
    public ResolutionResponse resolve(String sessionId, String userId, MatchQuery query) {
        requireIds(sessionId, userId);
        if (query == null) {
            throw new InvalidQueryException("Query is required");
        }
        query.validate();
        disambiguation.discard(sessionId);

        List<Transaction> snapshot = transactionRepository.findByUserId(userId);
        Map<String, Merchant> merchants = merchantService.catalog();
        RankingParameters params = matchingProperties.toRankingParameters();

        MatchResult result = ranker.rank(query, snapshot, merchants, params);
        outcomeCounters.get(result.getOutcome()).increment();

        String fingerprint = query.fingerprint();
        auditLogger.matchResolved(userId, sessionId, fingerprint, result.getOutcome(), result.getCandidates().size());
        log.info("Session {} query matched {} of {} transactions: {}", sessionId,
                result.getCandidates().size(), snapshot.size(), result.getOutcome());

        if (!result.isAmbiguous()) {
            return respond(sessionId, result, null);
        }
        disambiguation.open(sessionId, userId, fingerprint, result);
        auditLogger.clarificationRequested(userId, sessionId, fingerprint, result.getCandidates().size());
        return respond(sessionId, result, ClarificationRequest.of(sessionId, result.getCandidates(), merchants));
    }

    /**
     * Applies the user's answer to the session's clarification.
     *
     * @throws com.fintech.resolution.exception.StaleReferenceException if nothing is pending
     * @throws InvalidQueryException                                    if the answer names no offered candidate
     */
    @Transactional(readOnly = true)
    public ResolutionResponse select(String sessionId, String userId, Selection selection) {
        requireIds(sessionId, userId);
        if (selection == null) {
            throw new InvalidQueryException("Selection is required");
        }
        Map<String, Merchant> merchants = merchantService.catalog();

        MatchResult result;
        try {
            result = disambiguation.select(sessionId, userId, selection,
                    matchingProperties.toRankingParameters(), merchants);
        } catch (ResolutionException e) {
            selectionRejectedCounter.increment();
            log.info("Session {} selection rejected [{}]: {}", sessionId, e.getKind(), e.getMessage());
            throw e;
        }

        switch (result.getOutcome()) {
            case UNIQUE:
                selectionResolvedCounter.increment();
                auditLogger.selectionResolved(userId, sessionId, result.getBest().getTransaction().getId());
                return respond(sessionId, result, null);
            case AMBIGUOUS:
                selectionNarrowedCounter.increment();
                auditLogger.clarificationRequested(userId, sessionId,
                        selection.getRefinedQuery().fingerprint(), result.getCandidates().size());
                return respond(sessionId, result, ClarificationRequest.of(sessionId, result.getCandidates(), merchants));
            default:
                selectionEmptyCounter.increment();
                return respond(sessionId, result, null);
        }
    }

    /**
     * Records a turn that did not answer the clarification; the clarification
     * expires once it has gone unanswered long enough.
     */
    public DisambiguationState advanceTurn(String sessionId) {
        disambiguation.advanceTurn(sessionId);
        return disambiguation.stateOf(sessionId);
    }

    /**
     * Current state of the session, with the open clarification if there is one.
     */
    @Transactional(readOnly = true)
    public ResolutionResponse state(String sessionId) {
        Optional<PendingDisambiguation> pending = disambiguation.current(sessionId);
        if (pending.isEmpty()) {
            return respond(sessionId, null, null);
        }
        ClarificationRequest clarification = ClarificationRequest.of(
                sessionId, pending.get().getCandidates(), merchantService.catalog());
        return ResolutionResponse.builder()
                .sessionId(sessionId)
                .clarification(clarification)
                .state(DisambiguationState.AWAITING_CLARIFICATION)
                .build();
    }

    public int pendingClarifications() {
        return disambiguation.pendingCount();
    }

    private ResolutionResponse respond(String sessionId, MatchResult result, ClarificationRequest clarification) {
        return ResolutionResponse.builder()
                .sessionId(sessionId)
                .result(result)
                .clarification(clarification)
                .state(disambiguation.stateOf(sessionId))
                .build();
    }

    private static void requireIds(String sessionId, String userId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new InvalidQueryException("Session id is required");
        }
        if (userId == null || userId.isBlank()) {
            throw new InvalidQueryException("User id is required");
        }
    }
}
