package com.mlhub.server.exception;

/**
 * Root of the failures the prediction path can raise. The message is meant
 * for logs; only {@link ArtifactNotFoundException} and
 * {@link ValidationException} messages are returned to callers.
 */
public abstract class InferenceServiceException extends RuntimeException {

    protected InferenceServiceException(String message) {
        super(message);
    }

    protected InferenceServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
