package com.mlhub.server.ai.input;

import com.fasterxml.jackson.databind.JsonNode;
import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.ModelInput;
import com.mlhub.server.ai.tensor.NestedArrays;
import com.mlhub.server.api.PredictRequest;
import com.mlhub.server.exception.ValidationException;

/**
 * Flat or nested numbers from {@code inputs}. A flat list is one example of
 * N features.
 */
public class NumericInputNormalizer implements InputNormalizer {

    @Override
    public InputKind getKind() {
        return InputKind.NUMERIC;
    }

    @Override
    public void validate(PredictRequest request) {
        toTensor(request.inputs, "inputs");
    }

    @Override
    public ModelInput normalize(PredictRequest request, BackendHandle handle) {
        return ShapeChecks.requireCompatible(toTensor(request.inputs, "inputs"), handle, "inputs");
    }

    static CanonicalTensor toTensor(JsonNode node, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new ValidationException(field + " is required");
        }
        CanonicalTensor tensor;
        try {
            tensor = NestedArrays.fromJson(node);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(field + " must be a rectangular array of numbers: " + e.getMessage(), e);
        }
        if (tensor.size() == 0) {
            throw new ValidationException(field + " is empty");
        }
        return tensor.withBatchAxisIfVector();
    }
}
