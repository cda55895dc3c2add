package com.mlhub.server.ai.tensor;

/**
 * Anything a backend handle can be asked to run on: a canonical tensor, or an
 * opaque decoded image for backends that do their own preprocessing.
 */
public interface ModelInput {

    String describe();
}
