package com.fintech.resolution.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of one provider's circuit and rate-limit bucket.
 */
@Value
@Builder
public class ProviderHealth {

    String providerId;
    String circuitState;
    int bufferedCalls;
    int failedCalls;
    double availableTokens;
    int capacity;
}
