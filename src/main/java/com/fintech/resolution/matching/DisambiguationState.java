package com.fintech.resolution.matching;

public enum DisambiguationState {
    IDLE,
    AWAITING_CLARIFICATION
}
