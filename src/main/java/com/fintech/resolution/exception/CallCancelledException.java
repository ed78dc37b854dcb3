package com.fintech.resolution.exception;

public class CallCancelledException extends ResolutionException {

    public CallCancelledException(String providerId, Throwable cause) {
        super(ErrorKind.CANCELLED, "Call to provider " + providerId + " was abandoned", cause);
    }
}
