package com.mlhub.server.ai.inference;

import com.mlhub.server.ai.backend.BackendKind;
import com.mlhub.server.ai.tensor.CanonicalTensor;

public class InferenceResult {
    private final BackendKind backendKind;
    private final CanonicalTensor tensor;

    public InferenceResult(BackendKind backendKind, CanonicalTensor tensor) {
        this.backendKind = backendKind;
        this.tensor = tensor;
    }

    public BackendKind getBackendKind() {
        return backendKind;
    }

    /**
     * Dense output; null for structured detection results.
     */
    public CanonicalTensor getTensor() {
        return tensor;
    }

    public boolean isStructured() {
        return false;
    }

    @Override
    public String toString() {
        return "InferenceResult{" +
                "backend=" + backendKind +
                ", tensor=" + (tensor != null ? tensor.describe() : "N/A") +
                '}';
    }
}
