package com.mlhub.server.ai.inference;

import com.mlhub.server.ai.backend.BackendKind;
import com.mlhub.server.ai.tensor.ModelInput;
import com.mlhub.server.ai.tensor.TensorLayout;
import com.mlhub.server.ai.tensor.TensorShape;

import java.util.Optional;

/**
 * One loaded model and the backend that produced it. Implementations are
 * immutable after construction and must tolerate concurrent {@code infer}
 * calls.
 */
public interface BackendHandle {

    BackendKind getKind();

    /**
     * Declared shape of the first input, when the backend exposes one.
     */
    Optional<TensorShape> shape();

    /**
     * Layout image tensors must be built in for this backend.
     */
    TensorLayout layout();

    /**
     * Whether {@link #infer} takes a {@link com.mlhub.server.ai.tensor.DecodedImage}
     * directly instead of a preprocessed tensor.
     */
    default boolean acceptsDecodedImages() {
        return false;
    }

    InferenceResult infer(ModelInput input, InferenceMode mode);

    default InferenceResult infer(ModelInput input) {
        return infer(input, InferenceMode.STANDARD);
    }
}
