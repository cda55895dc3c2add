package com.mlhub.server.exception;

public class ArtifactNotFoundException extends InferenceServiceException {

    public ArtifactNotFoundException(String modelPath) {
        super("Model file not found: " + modelPath);
    }
}
