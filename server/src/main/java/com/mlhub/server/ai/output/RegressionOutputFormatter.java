package com.mlhub.server.ai.output;

import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.NestedArrays;
import com.mlhub.server.api.PredictResponse;
import com.mlhub.server.exception.InferenceFailureException;

import java.util.ArrayList;
import java.util.List;

public class RegressionOutputFormatter implements OutputFormatter {

    @Override
    public OutputKind getKind() {
        return OutputKind.REGRESSION;
    }

    @Override
    public void format(CanonicalTensor output, PredictResponse response) {
        if (output.isString()) {
            throw new InferenceFailureException("Regression output must be numeric, got " + output.describe());
        }
        response.prediction = NestedArrays.toNestedList(output);
        float[] values = output.getFloats();
        if (values.length == 1) {
            response.value = values[0];
            return;
        }
        List<Float> flat = new ArrayList<>(values.length);
        for (float v : values) {
            flat.add(v);
        }
        response.value = flat;
    }
}
