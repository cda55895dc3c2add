package com.mlhub.server.exception;

/**
 * The artifact's extension maps to no known backend and no fallback backend
 * could load it.
 */
public class UnsupportedBackendException extends InferenceServiceException {

    public UnsupportedBackendException(String message) {
        super(message);
    }
}
