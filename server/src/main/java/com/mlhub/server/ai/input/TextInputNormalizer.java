package com.mlhub.server.ai.input;

import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.ModelInput;
import com.mlhub.server.api.PredictRequest;
import com.mlhub.server.exception.ValidationException;

/**
 * Passes {@code text} through as a one-element string tensor. No
 * tokenization; the backend decides what a string input means.
 */
public class TextInputNormalizer implements InputNormalizer {

    @Override
    public InputKind getKind() {
        return InputKind.TEXT;
    }

    @Override
    public void validate(PredictRequest request) {
        if (request.text == null || request.text.trim().isEmpty()) {
            throw new ValidationException("text is required");
        }
    }

    @Override
    public ModelInput normalize(PredictRequest request, BackendHandle handle) {
        validate(request);
        return CanonicalTensor.ofStrings(new String[] { request.text }, 1);
    }
}
