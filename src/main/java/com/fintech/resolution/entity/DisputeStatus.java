package com.fintech.resolution.entity;

/**
 * Lifecycle of a dispute once it has been filed.
 */
public enum DisputeStatus {
    /**
     * Filed by the user, waiting for an agent.
     */
    FLAGGED,

    UNDER_REVIEW,

    /**
     * Closed by an agent. A resolved dispute no longer blocks a new one on the same transaction.
     */
    RESOLVED
}
