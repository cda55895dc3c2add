package com.mlhub.server.exception;

/**
 * A required field is missing for the declared input kind, or its payload is
 * empty or malformed.
 */
public class ValidationException extends InferenceServiceException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
