package com.fintech.resolution.exception;

public class NotFoundException extends ResolutionException {

    public NotFoundException(String resource, String id) {
        super(ErrorKind.NOT_FOUND, String.format("%s %s not found", resource, id));
    }
}
