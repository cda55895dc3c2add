package com.mlhub.server.ai.inference;

import ai.djl.repository.zoo.ZooModel;
import com.mlhub.server.ai.backend.BackendKind;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.TensorLayout;
import com.mlhub.server.ai.tensor.TensorShape;

import java.util.Optional;

/**
 * TorchScript module. Input shape is not discoverable; images are
 * channels-first. DJL predictors run the module with autograd disabled.
 */
public class DynamicModelHandle extends DjlTensorHandle {

    public DynamicModelHandle(ZooModel<CanonicalTensor, CanonicalTensor> model) {
        super(model);
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.DYNAMIC_MODEL;
    }

    @Override
    public Optional<TensorShape> shape() {
        return Optional.empty();
    }

    @Override
    public TensorLayout layout() {
        return TensorLayout.CHANNELS_FIRST;
    }
}
