package com.fintech.resolution.service;

import com.fintech.resolution.audit.AuditLogger;
import com.fintech.resolution.config.DisambiguationProperties;
import com.fintech.resolution.config.MatchingProperties;
import com.fintech.resolution.dto.ClarificationRequest.CandidateSummary;
import com.fintech.resolution.dto.MatchOutcome;
import com.fintech.resolution.dto.MatchQuery;
import com.fintech.resolution.dto.ResolutionResponse;
import com.fintech.resolution.dto.Selection;
import com.fintech.resolution.exception.InvalidQueryException;
import com.fintech.resolution.exception.StaleReferenceException;
import com.fintech.resolution.matching.DisambiguationService;
import com.fintech.resolution.matching.DisambiguationState;
import com.fintech.resolution.matching.MatchScorer;
import com.fintech.resolution.matching.MerchantResolver;
import com.fintech.resolution.matching.TransactionRanker;
import com.fintech.resolution.repository.TransactionRepository;
import com.fintech.resolution.support.MutableClock;
import com.fintech.resolution.support.TestData;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static com.fintech.resolution.support.TestData.USER;
import static com.fintech.resolution.support.TestData.txn;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TransactionResolutionService.
 * <p>
 * Tests cover:
 * - Resolving unique, ambiguous and empty queries
 * - The clarification round trip
 * - Session isolation between queries
 * - Metrics and audit events
 */
@ExtendWith(MockitoExtension.class)
class TransactionResolutionServiceTest {

    private static final String SESSION = "session-1";

    @Mock
    private TransactionRepository transactionRepository;

    @Mock
    private MerchantService merchantService;

    @Mock
    private AuditLogger auditLogger;

    private SimpleMeterRegistry meterRegistry;
    private TransactionResolutionService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        TransactionRanker ranker = new TransactionRanker(new MatchScorer(new MerchantResolver()));
        DisambiguationService disambiguation = new DisambiguationService(ranker, new DisambiguationProperties(),
                MutableClock.startingAt("2024-03-15T10:00:00Z"));
        service = new TransactionResolutionService(transactionRepository, merchantService, ranker,
                disambiguation, new MatchingProperties(), auditLogger, meterRegistry);
        service.initMetrics();
    }

    private void givenLedger() {
        when(transactionRepository.findByUserId(USER)).thenReturn(List.of(
                txn("t_coffee", "48.50", "2024-03-14", "m_coffee"),
                txn("t_amz_1", "15.00", "2024-03-10", "m_amazon"),
                txn("t_amz_2", "15.00", "2024-03-12", "m_amazon")));
        when(merchantService.catalog()).thenReturn(TestData.catalog(TestData.coffeePalace(), TestData.amazon()));
    }

    private static MatchQuery amazonCharge() {
        return MatchQuery.builder().amount(new BigDecimal("15.00")).merchantText("Amazon").build();
    }

    private double outcomeCount(MatchOutcome outcome) {
        return meterRegistry.get("resolution.match.outcome").tag("outcome", outcome.name()).counter().count();
    }

    @Nested
    @DisplayName("Resolve Tests")
    class ResolveTests {

        @Test
        @DisplayName("Should resolve a unique match without opening a clarification")
        void uniqueMatch() {
            // Given
            givenLedger();
            MatchQuery query = MatchQuery.builder().amount(new BigDecimal("50")).merchantText("coffee palace").build();

            // When
            ResolutionResponse response = service.resolve(SESSION, USER, query);

            // Then
            assertThat(response.getResult().getOutcome()).isEqualTo(MatchOutcome.UNIQUE);
            assertThat(response.getResult().getBest().getTransaction().getId()).isEqualTo("t_coffee");
            assertThat(response.getClarification()).isNull();
            assertThat(response.getState()).isEqualTo(DisambiguationState.IDLE);
            assertThat(outcomeCount(MatchOutcome.UNIQUE)).isEqualTo(1.0);
            verify(auditLogger).matchResolved(eq(USER), eq(SESSION), eq(query.fingerprint()), eq(MatchOutcome.UNIQUE), eq(1));
        }

        @Test
        @DisplayName("Should open a clarification with 1-based references for an ambiguous match")
        void ambiguousMatch() {
            // Given
            givenLedger();

            // When
            ResolutionResponse response = service.resolve(SESSION, USER, amazonCharge());

            // Then
            assertThat(response.getState()).isEqualTo(DisambiguationState.AWAITING_CLARIFICATION);
            assertThat(response.getClarification().getCandidates())
                    .extracting(CandidateSummary::getReference, CandidateSummary::getTransactionId,
                            CandidateSummary::getMerchantName)
                    .containsExactly(
                            tuple(1, "t_amz_2", "Amazon"),
                            tuple(2, "t_amz_1", "Amazon"));
            assertThat(outcomeCount(MatchOutcome.AMBIGUOUS)).isEqualTo(1.0);
            verify(auditLogger).clarificationRequested(USER, SESSION, amazonCharge().fingerprint(), 2);
        }

        @Test
        @DisplayName("Should report an empty result as an outcome, not an error")
        void emptyMatch() {
            givenLedger();

            ResolutionResponse response = service.resolve(SESSION, USER,
                    MatchQuery.builder().amount(new BigDecimal("999")).build());

            assertThat(response.getResult().getOutcome()).isEqualTo(MatchOutcome.EMPTY);
            assertThat(response.getState()).isEqualTo(DisambiguationState.IDLE);
        }

        @Test
        @DisplayName("Should reject a query without identifying fields before touching storage")
        void invalidQuery() {
            assertThatThrownBy(() -> service.resolve(SESSION, USER, MatchQuery.builder().category("Shopping").build()))
                    .isInstanceOf(InvalidQueryException.class);

            verifyNoInteractions(transactionRepository, merchantService, auditLogger);
        }

        @Test
        @DisplayName("Should require a user id")
        void missingUser() {
            assertThatThrownBy(() -> service.resolve(SESSION, " ", amazonCharge()))
                    .isInstanceOf(InvalidQueryException.class);
        }

        @Test
        @DisplayName("A new query discards the clarification of the previous one")
        void freshQueryDiscardsPending() {
            // Given
            givenLedger();
            service.resolve(SESSION, USER, amazonCharge());

            // When
            ResolutionResponse response = service.resolve(SESSION, USER,
                    MatchQuery.builder().transactionId("t_coffee").build());

            // Then
            assertThat(response.getState()).isEqualTo(DisambiguationState.IDLE);
            assertThatThrownBy(() -> service.select(SESSION, USER, Selection.byRank(1)))
                    .isInstanceOf(StaleReferenceException.class);
        }
    }

    @Nested
    @DisplayName("Clarification Tests")
    class ClarificationTests {

        @Test
        @DisplayName("Should resolve the candidate the user picked by reference")
        void selectByReference() {
            // Given
            givenLedger();
            service.resolve(SESSION, USER, amazonCharge());

            // When
            ResolutionResponse response = service.select(SESSION, USER, Selection.byRank(2));

            // Then
            assertThat(response.getResult().getOutcome()).isEqualTo(MatchOutcome.UNIQUE);
            assertThat(response.getResult().getBest().getTransaction().getId()).isEqualTo("t_amz_1");
            assertThat(response.getState()).isEqualTo(DisambiguationState.IDLE);
            verify(auditLogger).selectionResolved(USER, SESSION, "t_amz_1");
            assertThat(meterRegistry.get("resolution.selection").tag("result", "resolved").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should count and rethrow a stale selection")
        void staleSelection() {
            when(merchantService.catalog()).thenReturn(TestData.catalog(TestData.amazon()));

            assertThatThrownBy(() -> service.select(SESSION, USER, Selection.byRank(1)))
                    .isInstanceOf(StaleReferenceException.class);

            assertThat(meterRegistry.get("resolution.selection").tag("result", "rejected").counter().count())
                    .isEqualTo(1.0);
            verify(auditLogger, never()).selectionResolved(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("Should expire the clarification after an unrelated turn")
        void advanceTurnExpires() {
            givenLedger();
            service.resolve(SESSION, USER, amazonCharge());

            assertThat(service.advanceTurn(SESSION)).isEqualTo(DisambiguationState.IDLE);
            assertThat(service.pendingClarifications()).isZero();
        }

        @Test
        @DisplayName("Should expose the open clarification in the session state")
        void sessionState() {
            givenLedger();
            service.resolve(SESSION, USER, amazonCharge());

            ResolutionResponse state = service.state(SESSION);

            assertThat(state.getState()).isEqualTo(DisambiguationState.AWAITING_CLARIFICATION);
            assertThat(state.getClarification().getCandidates()).hasSize(2);
            assertThat(state.getResult()).isNull();
        }

        @Test
        @DisplayName("Should keep sessions apart")
        void sessionsAreIsolated() {
            givenLedger();
            service.resolve(SESSION, USER, amazonCharge());

            assertThat(service.state("session-2").getState()).isEqualTo(DisambiguationState.IDLE);
            verify(auditLogger, never()).selectionResolved(anyString(), anyString(), anyString());
            verify(auditLogger, times(1)).clarificationRequested(anyString(), anyString(), anyString(), anyInt());
            verify(auditLogger, times(1)).matchResolved(anyString(), anyString(), anyString(), any(), anyInt());
        }
    }
}
