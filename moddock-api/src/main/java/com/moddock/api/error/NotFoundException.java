package com.moddock.api.error;

/**
 * Entity is absent, or its existence is masked from the caller.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
