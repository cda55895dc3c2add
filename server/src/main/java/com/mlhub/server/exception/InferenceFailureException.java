package com.mlhub.server.exception;

/**
 * The backend raised while executing, or its input/output could not be
 * converted (shape mismatch, unsupported operator, decode error).
 */
public class InferenceFailureException extends InferenceServiceException {

    public InferenceFailureException(String message) {
        super(message);
    }

    public InferenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
