package com.fintech.resolution.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ranked outcome of matching a query against a snapshot.
 * Candidates are ordered best first; {@code best} is null only when the outcome is EMPTY.
 */
@Value
@Builder
public class MatchResult {

    MatchOutcome outcome;
    List<MatchCandidate> candidates;
    MatchCandidate best;

    public static MatchResult empty() {
        return new MatchResult(MatchOutcome.EMPTY, List.of(), null);
    }

    public static MatchResult unique(MatchCandidate candidate) {
        return new MatchResult(MatchOutcome.UNIQUE, List.of(candidate), candidate);
    }

    public static MatchResult ranked(MatchOutcome outcome, List<MatchCandidate> candidates) {
        return new MatchResult(outcome, List.copyOf(candidates), candidates.isEmpty() ? null : candidates.get(0));
    }

    public boolean isAmbiguous() {
        return outcome == MatchOutcome.AMBIGUOUS;
    }
}
