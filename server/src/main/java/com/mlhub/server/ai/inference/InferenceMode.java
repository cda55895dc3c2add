package com.mlhub.server.ai.inference;

public enum InferenceMode {
    STANDARD,
    /** Detection backends render their boxes onto the input image. */
    ANNOTATED_IMAGE
}
