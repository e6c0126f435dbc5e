package com.moddock.api.error;

/**
 * Request data is malformed or refers to something that does not resolve.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
