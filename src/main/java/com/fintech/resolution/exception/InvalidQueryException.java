package com.fintech.resolution.exception;

/**
 * Thrown before scoring when a query or selection cannot be acted on.
 */
public class InvalidQueryException extends ResolutionException {

    public InvalidQueryException(String message) {
        super(ErrorKind.INVALID_QUERY, message);
    }
}
