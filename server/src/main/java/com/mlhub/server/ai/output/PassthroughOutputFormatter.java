package com.mlhub.server.ai.output;

import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.NestedArrays;
import com.mlhub.server.api.PredictResponse;

/**
 * Text and raw JSON outputs: the nested values, uninterpreted.
 */
public class PassthroughOutputFormatter implements OutputFormatter {

    private final OutputKind kind;

    public PassthroughOutputFormatter(OutputKind kind) {
        this.kind = kind;
    }

    @Override
    public OutputKind getKind() {
        return kind;
    }

    @Override
    public void format(CanonicalTensor output, PredictResponse response) {
        response.prediction = NestedArrays.toNestedList(output);
    }
}
