package com.fintech.resolution.service;

import com.fintech.resolution.resilience.ResilientCallExecutor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Calls the reasoning provider through the shared resilience wrapper.
 */
@Service
@RequiredArgsConstructor
public class ReasoningService {

    private final ReasoningClient reasoningClient;
    private final ResilientCallExecutor callExecutor;

    public String complete(String prompt) {
        return callExecutor.execute(reasoningClient.getProviderName(), () -> reasoningClient.complete(prompt));
    }

    public String getProviderName() {
        return reasoningClient.getProviderName();
    }
}
