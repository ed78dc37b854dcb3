package com.fintech.resolution.controller;

import com.fintech.resolution.entity.Merchant;
import com.fintech.resolution.service.MerchantService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/merchants")
@RequiredArgsConstructor
@Tag(name = "Merchants", description = "Merchant lookup API")
public class MerchantController {

    private final MerchantService merchantService;

    @Operation(
            summary = "Search merchants by name",
            description = "Case-insensitive lookup over canonical names and aliases. Exact canonical matches come first, then alias matches, then partial matches."
    )
    @ApiResponse(responseCode = "200", description = "Matching merchants, possibly none")
    @GetMapping("/search")
    public ResponseEntity<List<Merchant>> search(
            @Parameter(description = "Merchant name as seen by the user") @RequestParam String name) {
        return ResponseEntity.ok(merchantService.search(name));
    }

    @Operation(summary = "Get merchant by ID")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Merchant found"),
            @ApiResponse(responseCode = "404", description = "Merchant not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<Merchant> getMerchant(
            @Parameter(description = "Merchant ID") @PathVariable String id) {
        return ResponseEntity.ok(merchantService.getMerchant(id));
    }
}
