package com.fintech.resolution.exception;

public class StaleReferenceException extends ResolutionException {

    private final String sessionId;

    public StaleReferenceException(String sessionId) {
        super(ErrorKind.STALE_REFERENCE,
                "No pending clarification for this session; it was resolved, replaced or has expired");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
