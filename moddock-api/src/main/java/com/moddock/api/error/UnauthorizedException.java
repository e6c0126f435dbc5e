package com.moddock.api.error;

/**
 * No identity could be resolved from the request credentials.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }
}
