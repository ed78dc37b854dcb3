package com.fintech.resolution.exception;

/**
 * Thrown when a transaction already carries a dispute that is not resolved.
 */
public class DisputeConflictException extends ResolutionException {

    private final String existingDisputeId;

    public DisputeConflictException(String transactionId, String existingDisputeId) {
        super(ErrorKind.DISPUTE_ALREADY_OPEN, String.format(
                "Transaction %s already has an open dispute (ID: %s)", transactionId, existingDisputeId));
        this.existingDisputeId = existingDisputeId;
    }

    public String getExistingDisputeId() {
        return existingDisputeId;
    }
}
