package com.mlhub.server.ai.input;

import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.tensor.ModelInput;
import com.mlhub.server.api.PredictRequest;

/**
 * Turns the payload of one input kind into something a backend handle can
 * run, shaped for that handle.
 */
public interface InputNormalizer {

    InputKind getKind();

    /**
     * Checks that the request carries this kind's payload. Runs before the
     * model is loaded.
     *
     * @throws com.mlhub.server.exception.ValidationException when the field is
     *                                                        missing or
     *                                                        malformed
     */
    void validate(PredictRequest request);

    ModelInput normalize(PredictRequest request, BackendHandle handle);
}
