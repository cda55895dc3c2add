package com.mlhub.server.exception;

import com.mlhub.server.ai.backend.BackendKind;

/**
 * The artifact exists but could not be constructed under any candidate
 * backend.
 */
public class ModelLoadException extends InferenceServiceException {

    private final BackendKind kind;

    public ModelLoadException(BackendKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ModelLoadException(BackendKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Backend that was being constructed, or null when the failure is not
     * specific to one.
     */
    public BackendKind getKind() {
        return kind;
    }
}
