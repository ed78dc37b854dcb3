package com.fintech.resolution.matching;

/**
 * Independent axes along which a transaction is compared to a query.
 */
public enum ScoreDimension {
    AMOUNT,
    DATE,
    MERCHANT
}
