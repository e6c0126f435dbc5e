package com.moddock.api.error;

/**
 * Resolved identity lacks the permission for the operation.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
