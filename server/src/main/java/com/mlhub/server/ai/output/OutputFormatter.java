package com.mlhub.server.ai.output;

import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.api.PredictResponse;

/**
 * Fills the response fields for one output kind from a dense inference
 * result.
 */
public interface OutputFormatter {

    OutputKind getKind();

    void format(CanonicalTensor output, PredictResponse response);
}
