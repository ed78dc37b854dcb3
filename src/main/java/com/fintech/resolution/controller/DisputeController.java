package com.fintech.resolution.controller;

import com.fintech.resolution.dto.DisputeRequest;
import com.fintech.resolution.entity.Dispute;
import com.fintech.resolution.service.DisputeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for flagging identified transactions for human review.
 */
@RestController
@RequestMapping("/api/v1/disputes")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Disputes", description = "Dispute filing API")
public class DisputeController {

    private final DisputeService disputeService;

    @Operation(
            summary = "Flag a transaction for review",
            description = "Files a dispute on one of the caller's transactions. Refused while another dispute on the same transaction is unresolved."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Dispute filed"),
            @ApiResponse(responseCode = "404", description = "Transaction not found for this user"),
            @ApiResponse(responseCode = "409", description = "An open dispute already exists")
    })
    @PostMapping
    public ResponseEntity<Dispute> flagForReview(
            @Parameter(description = "Caller's user ID") @RequestHeader(ResolutionController.USER_HEADER) String userId,
            @Valid @RequestBody DisputeRequest request) {
        Dispute dispute = disputeService.flagForReview(userId, request.getTransactionId(), request.getComplaint());
        return ResponseEntity.status(HttpStatus.CREATED).body(dispute);
    }

    @Operation(summary = "Get dispute by ID", description = "Only the caller's own disputes are visible.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Dispute found"),
            @ApiResponse(responseCode = "404", description = "Dispute not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<Dispute> getDispute(
            @Parameter(description = "Caller's user ID") @RequestHeader(ResolutionController.USER_HEADER) String userId,
            @Parameter(description = "Dispute ID") @PathVariable String id) {
        return ResponseEntity.ok(disputeService.getDispute(userId, id));
    }

    @Operation(summary = "List the caller's disputes", description = "Newest first.")
    @ApiResponse(responseCode = "200", description = "Disputes retrieved")
    @GetMapping
    public ResponseEntity<List<Dispute>> listDisputes(
            @Parameter(description = "Caller's user ID") @RequestHeader(ResolutionController.USER_HEADER) String userId) {
        return ResponseEntity.ok(disputeService.listDisputes(userId));
    }
}
