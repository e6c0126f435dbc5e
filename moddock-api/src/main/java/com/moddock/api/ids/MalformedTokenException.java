package com.moddock.api.ids;

/**
 * Thrown when a client-supplied base62 string cannot be decoded.
 */
public class MalformedTokenException extends RuntimeException {

    public MalformedTokenException(String message) {
        super(message);
    }
}
