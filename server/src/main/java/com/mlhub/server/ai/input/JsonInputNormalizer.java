package com.mlhub.server.ai.input;

import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.tensor.ModelInput;
import com.mlhub.server.api.PredictRequest;

/**
 * Arbitrary nested numeric structure from {@code json_data}; same promotion
 * rule as numeric input.
 */
public class JsonInputNormalizer implements InputNormalizer {

    @Override
    public InputKind getKind() {
        return InputKind.JSON;
    }

    @Override
    public void validate(PredictRequest request) {
        NumericInputNormalizer.toTensor(request.jsonData, "json_data");
    }

    @Override
    public ModelInput normalize(PredictRequest request, BackendHandle handle) {
        return ShapeChecks.requireCompatible(NumericInputNormalizer.toTensor(request.jsonData, "json_data"), handle,
                "json_data");
    }
}
