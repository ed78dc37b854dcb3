package com.fintech.resolution.entity;

/**
 * Represents the booking status of a card transaction.
 */
public enum TransactionStatus {
    /**
     * Authorized by the card network but not yet settled.
     */
    PENDING,

    /**
     * Settled and visible on the statement.
     */
    POSTED,

    /**
     * Settled and later refunded by the merchant.
     */
    REFUNDED
}
