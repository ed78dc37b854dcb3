package com.fintech.resolution.dto;

import com.fintech.resolution.matching.DisambiguationState;
import lombok.Builder;
import lombok.Value;

/**
 * Result of one resolution turn. {@code clarification} is set exactly when the
 * session is left waiting for the user to choose.
 */
@Value
@Builder
public class ResolutionResponse {

    String sessionId;
    MatchResult result;
    ClarificationRequest clarification;
    DisambiguationState state;
}
