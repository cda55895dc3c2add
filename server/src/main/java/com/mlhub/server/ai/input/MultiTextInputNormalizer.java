package com.mlhub.server.ai.input;

import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.ModelInput;
import com.mlhub.server.api.PredictRequest;
import com.mlhub.server.exception.ValidationException;

public class MultiTextInputNormalizer implements InputNormalizer {

    @Override
    public InputKind getKind() {
        return InputKind.MULTI_TEXT;
    }

    @Override
    public void validate(PredictRequest request) {
        if (request.texts == null || request.texts.isEmpty()) {
            throw new ValidationException("texts array is required");
        }
        if (request.texts.contains(null)) {
            throw new ValidationException("texts must not contain null entries");
        }
    }

    @Override
    public ModelInput normalize(PredictRequest request, BackendHandle handle) {
        validate(request);
        String[] texts = request.texts.toArray(new String[0]);
        return CanonicalTensor.ofStrings(texts, texts.length);
    }
}
