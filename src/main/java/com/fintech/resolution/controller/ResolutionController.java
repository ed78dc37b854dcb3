package com.fintech.resolution.controller;

import com.fintech.resolution.dto.MatchQueryRequest;
import com.fintech.resolution.dto.ResolutionResponse;
import com.fintech.resolution.dto.SelectionRequest;
import com.fintech.resolution.matching.DisambiguationState;
import com.fintech.resolution.resilience.ProviderResilienceRegistry;
import com.fintech.resolution.service.TransactionResolutionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for identifying a transaction over one or more conversation turns.
 * <p>
 * Provides endpoints for:
 * - Matching a description against the caller's transactions
 * - Answering a clarification
 * - Advancing the conversation without answering
 * - Inspecting session and provider health
 */
@RestController
@RequestMapping("/api/v1/resolution")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Resolution", description = "Fuzzy transaction resolution API")
public class ResolutionController {

    static final String USER_HEADER = "X-User-Id";

    private final TransactionResolutionService resolutionService;
    private final ProviderResilienceRegistry resilienceRegistry;

    @Operation(
            summary = "Match a transaction description",
            description = "Ranks the caller's transactions against amount, date and merchant. An ambiguous result opens a clarification for the session and replaces any earlier one."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Query matched (unique, ambiguous or empty)",
                    content = @Content(schema = @Schema(implementation = ResolutionResponse.class))),
            @ApiResponse(responseCode = "400", description = "Query identifies nothing or is malformed")
    })
    @PostMapping("/sessions/{sessionId}/match")
    public ResponseEntity<ResolutionResponse> match(
            @Parameter(description = "Conversation session ID") @PathVariable String sessionId,
            @Parameter(description = "Caller's user ID") @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody MatchQueryRequest request) {
        return ResponseEntity.ok(resolutionService.resolve(sessionId, userId, request.toQuery()));
    }

    @Operation(
            summary = "Answer a clarification",
            description = "Selects a candidate by reference or transaction ID, or narrows the candidates with a refined query."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Selection applied",
                    content = @Content(schema = @Schema(implementation = ResolutionResponse.class))),
            @ApiResponse(responseCode = "400", description = "Reference or transaction is not among the candidates"),
            @ApiResponse(responseCode = "409", description = "No clarification pending for this session")
    })
    @PostMapping("/sessions/{sessionId}/selection")
    public ResponseEntity<ResolutionResponse> select(
            @Parameter(description = "Conversation session ID") @PathVariable String sessionId,
            @Parameter(description = "Caller's user ID") @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody SelectionRequest request) {
        return ResponseEntity.ok(resolutionService.select(sessionId, userId, request.toSelection()));
    }

    @Operation(
            summary = "Record an unrelated turn",
            description = "Counts a conversation turn that did not answer the clarification. The clarification expires once it has gone unanswered for the configured number of turns."
    )
    @ApiResponse(responseCode = "200", description = "Session state after the turn")
    @PostMapping("/sessions/{sessionId}/turns")
    public ResponseEntity<Map<String, Object>> advanceTurn(
            @Parameter(description = "Conversation session ID") @PathVariable String sessionId) {
        DisambiguationState state = resolutionService.advanceTurn(sessionId);
        return ResponseEntity.ok(Map.of("sessionId", sessionId, "state", state));
    }

    @Operation(
            summary = "Get session state",
            description = "Returns whether the session is waiting for a clarification, with the open candidate list."
    )
    @ApiResponse(responseCode = "200", description = "Session state",
            content = @Content(schema = @Schema(implementation = ResolutionResponse.class)))
    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<ResolutionResponse> getSession(
            @Parameter(description = "Conversation session ID") @PathVariable String sessionId) {
        return ResponseEntity.ok(resolutionService.state(sessionId));
    }

    @Operation(
            summary = "Health check",
            description = "Returns circuit state and available rate-limit tokens per provider, and the number of pending clarifications."
    )
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = Map.of(
                "status", "UP",
                "pendingClarifications", resolutionService.pendingClarifications(),
                "providers", resilienceRegistry.health()
        );
        return ResponseEntity.ok(health);
    }
}
