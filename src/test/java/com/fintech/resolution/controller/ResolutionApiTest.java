package com.fintech.resolution.controller;

import com.fintech.resolution.entity.Merchant;
import com.fintech.resolution.entity.Transaction;
import com.fintech.resolution.entity.TransactionStatus;
import com.fintech.resolution.repository.DisputeRepository;
import com.fintech.resolution.repository.MerchantRepository;
import com.fintech.resolution.repository.TransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP contract of the resolution, merchant and dispute endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ResolutionApiTest {

    private static final String USER = "user_001";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private MerchantRepository merchantRepository;

    @Autowired
    private DisputeRepository disputeRepository;

    private String session;

    @BeforeEach
    void setUp() {
        disputeRepository.deleteAll();
        transactionRepository.deleteAll();
        merchantRepository.deleteAll();

        merchantRepository.save(Merchant.builder().id("merch_amazon").canonicalName("Amazon")
                .alias("AMZN").category("Shopping").build());
        transactionRepository.saveAll(List.of(
                transaction("txn_002", "2024-03-10"),
                transaction("txn_003", "2024-03-12")));

        session = "api-" + UUID.randomUUID();
    }

    private String matchUrl() {
        return "/api/v1/resolution/sessions/" + session + "/match";
    }

    private String selectionUrl() {
        return "/api/v1/resolution/sessions/" + session + "/selection";
    }

    @Nested
    @DisplayName("Resolution Endpoint Tests")
    class ResolutionEndpointTests {

        @Test
        @DisplayName("Should return the clarification for an ambiguous match")
        void ambiguousMatch() throws Exception {
            mockMvc.perform(post(matchUrl())
                            .header(ResolutionController.USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"amount\": 15.00, \"merchant\": \"AMZN\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.state").value("AWAITING_CLARIFICATION"))
                    .andExpect(jsonPath("$.clarification.candidates[0].reference").value(1))
                    .andExpect(jsonPath("$.clarification.candidates[0].transactionId").value("txn_003"));

            mockMvc.perform(post(selectionUrl())
                            .header(ResolutionController.USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"transactionId\": \"txn_002\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.state").value("IDLE"))
                    .andExpect(jsonPath("$.result.outcome").value("UNIQUE"));
        }

        @Test
        @DisplayName("Should answer 400 for a query without identifying fields")
        void emptyQuery() throws Exception {
            mockMvc.perform(post(matchUrl())
                            .header(ResolutionController.USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"category\": \"Shopping\"}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_QUERY"));
        }

        @Test
        @DisplayName("Should answer 400 when the user header is missing")
        void missingUserHeader() throws Exception {
            mockMvc.perform(post(matchUrl())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"amount\": 15.00}"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("Should answer 400 for a negative amount")
        void negativeAmount() throws Exception {
            mockMvc.perform(post(matchUrl())
                            .header(ResolutionController.USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"amount\": -5}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
        }

        @Test
        @DisplayName("Should answer 409 for a selection with nothing pending")
        void staleSelection() throws Exception {
            mockMvc.perform(post(selectionUrl())
                            .header(ResolutionController.USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"reference\": 1}"))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("STALE_REFERENCE"));
        }

        @Test
        @DisplayName("Should expire the clarification after an unrelated turn")
        void unrelatedTurn() throws Exception {
            mockMvc.perform(post(matchUrl())
                            .header(ResolutionController.USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"amount\": 15.00}"))
                    .andExpect(jsonPath("$.state").value("AWAITING_CLARIFICATION"));

            mockMvc.perform(post("/api/v1/resolution/sessions/" + session + "/turns"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.state").value("IDLE"));
        }

        @Test
        @DisplayName("Should report provider health")
        void health() throws Exception {
            mockMvc.perform(get("/api/v1/resolution/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("UP"));
        }

        @Test
        @DisplayName("Should publish the API description")
        void apiDocs() throws Exception {
            mockMvc.perform(get("/v3/api-docs"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.info.title").value("Transaction Resolution Service API"))
                    .andExpect(jsonPath("$.info.contact").doesNotExist())
                    .andExpect(jsonPath("$.paths['/api/v1/resolution/sessions/{sessionId}/match']").exists());
        }
    }

    @Nested
    @DisplayName("Merchant And Dispute Endpoint Tests")
    class MerchantAndDisputeEndpointTests {

        @Test
        @DisplayName("Should find a merchant by alias")
        void merchantSearch() throws Exception {
            mockMvc.perform(get("/api/v1/merchants/search").param("name", "amzn"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].canonicalName").value("Amazon"));
        }

        @Test
        @DisplayName("Should answer 404 for an unknown merchant")
        void unknownMerchant() throws Exception {
            mockMvc.perform(get("/api/v1/merchants/merch_unknown"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.code").value("NOT_FOUND"));
        }

        @Test
        @DisplayName("Should create a dispute once and refuse the duplicate")
        void disputeLifecycle() throws Exception {
            String body = "{\"transactionId\": \"txn_002\", \"complaint\": \"Charged twice\"}";

            mockMvc.perform(post("/api/v1/disputes")
                            .header(ResolutionController.USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.status").value("FLAGGED"));

            mockMvc.perform(post("/api/v1/disputes")
                            .header(ResolutionController.USER_HEADER, USER)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(body))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.code").value("DISPUTE_ALREADY_OPEN"));
        }

        @Test
        @DisplayName("Should hide another user's transaction")
        void foreignTransaction() throws Exception {
            mockMvc.perform(post("/api/v1/disputes")
                            .header(ResolutionController.USER_HEADER, "user_002")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"transactionId\": \"txn_002\", \"complaint\": \"Not mine\"}"))
                    .andExpect(status().isNotFound());
        }
    }

    private static Transaction transaction(String id, String date) {
        return Transaction.builder()
                .id(id)
                .userId(USER)
                .amount(new BigDecimal("15.00"))
                .currency("USD")
                .transactionDate(LocalDate.parse(date))
                .merchantId("merch_amazon")
                .status(TransactionStatus.POSTED)
                .description("Card purchase")
                .build();
    }
}
