package com.fintech.resolution.exception;

/**
 * Base exception for transaction resolution errors.
 */
public class ResolutionException extends RuntimeException {

    private final ErrorKind kind;

    public ResolutionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ResolutionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
