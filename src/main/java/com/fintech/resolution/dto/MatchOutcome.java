package com.fintech.resolution.dto;

public enum MatchOutcome {
    /**
     * One candidate stands out; it can be acted on directly.
     */
    UNIQUE,

    /**
     * Several candidates are too close to call; the user has to pick.
     */
    AMBIGUOUS,

    /**
     * Nothing cleared the acceptance threshold.
     */
    EMPTY
}
