package com.mlhub.server.ai.inference;

import ai.djl.inference.Predictor;
import ai.djl.repository.zoo.ZooModel;
import ai.djl.translate.TranslateException;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.ModelInput;
import com.mlhub.server.exception.InferenceFailureException;

/**
 * Shared execution path for DJL models that map one tensor to one tensor.
 * The model is thread-safe; predictors are not, so each call opens its own.
 */
abstract class DjlTensorHandle implements BackendHandle {

    protected final ZooModel<CanonicalTensor, CanonicalTensor> model;

    protected DjlTensorHandle(ZooModel<CanonicalTensor, CanonicalTensor> model) {
        this.model = model;
    }

    @Override
    public InferenceResult infer(ModelInput input, InferenceMode mode) {
        CanonicalTensor tensor = requireTensor(input);
        try (Predictor<CanonicalTensor, CanonicalTensor> predictor = model.newPredictor()) {
            return new InferenceResult(getKind(), predictor.predict(tensor));
        } catch (TranslateException e) {
            throw new InferenceFailureException(getKind() + " inference failed on " + tensor.describe(), e);
        }
    }

    static CanonicalTensor requireTensor(ModelInput input) {
        if (!(input instanceof CanonicalTensor)) {
            throw new InferenceFailureException("Backend needs a tensor input, got " + input.describe());
        }
        return (CanonicalTensor) input;
    }
}
