package com.fintech.resolution.matching;

/**
 * How a piece of merchant text relates to a merchant record, strongest first.
 */
public enum MerchantMatchType {
    CANONICAL_NAME,
    ALIAS,
    /**
     * One side contains the other, e.g. "amazon" vs "Amazon.com".
     */
    PARTIAL,
    NONE
}
