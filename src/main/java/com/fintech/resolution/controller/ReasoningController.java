package com.fintech.resolution.controller;

import com.fintech.resolution.dto.ReasoningRequest;
import com.fintech.resolution.service.ReasoningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/reasoning")
@RequiredArgsConstructor
@Tag(name = "Reasoning", description = "Guarded access to the reasoning provider")
public class ReasoningController {

    private final ReasoningService reasoningService;

    @Operation(
            summary = "Send a prompt to the reasoning provider",
            description = "The call is rate limited, circuit broken and retried on transient failures."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Provider answered"),
            @ApiResponse(responseCode = "429", description = "Rate limit reached"),
            @ApiResponse(responseCode = "502", description = "Provider kept failing or rejected the prompt"),
            @ApiResponse(responseCode = "503", description = "Circuit open")
    })
    @PostMapping("/complete")
    public ResponseEntity<Map<String, String>> complete(@Valid @RequestBody ReasoningRequest request) {
        String reply = reasoningService.complete(request.getPrompt());
        return ResponseEntity.ok(Map.of("provider", reasoningService.getProviderName(), "reply", reply));
    }
}
