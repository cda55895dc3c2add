package com.mlhub.server.ai.inference;

import ai.djl.ndarray.types.Shape;
import ai.djl.repository.zoo.ZooModel;
import ai.djl.util.PairList;
import com.mlhub.server.ai.backend.BackendKind;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.TensorLayout;
import com.mlhub.server.ai.tensor.TensorShape;

import java.util.Optional;

/**
 * TensorFlow SavedModel. Shape comes from the serving signature; images are
 * channels-last.
 */
public class GraphModelHandle extends DjlTensorHandle {

    private final TensorShape shape;

    public GraphModelHandle(ZooModel<CanonicalTensor, CanonicalTensor> model) {
        super(model);
        PairList<String, Shape> inputs = model.describeInput();
        if (inputs != null && !inputs.isEmpty()) {
            this.shape = new TensorShape(inputs.valueAt(0).getShape(), TensorLayout.CHANNELS_LAST);
        } else {
            this.shape = null;
        }
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.GRAPH_MODEL;
    }

    @Override
    public Optional<TensorShape> shape() {
        return Optional.ofNullable(shape);
    }

    @Override
    public TensorLayout layout() {
        return TensorLayout.CHANNELS_LAST;
    }
}
