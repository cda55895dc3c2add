package com.mlhub.server.ai.inference;

import ai.djl.ndarray.NDArray;
import ai.djl.ndarray.NDList;
import ai.djl.ndarray.NDManager;
import ai.djl.ndarray.types.DataType;
import ai.djl.ndarray.types.Shape;
import ai.djl.translate.Batchifier;
import ai.djl.translate.Translator;
import ai.djl.translate.TranslatorContext;
import com.mlhub.server.ai.tensor.CanonicalTensor;

/**
 * Feeds a canonical tensor to a DJL model as its single input and copies the
 * first output back out before the predictor's memory is released. Tuple and
 * list outputs arrive flattened in the {@link NDList}, so the first element
 * is the first output.
 */
public class TensorTranslator implements Translator<CanonicalTensor, CanonicalTensor> {

    @Override
    public NDList processInput(TranslatorContext ctx, CanonicalTensor input) {
        NDManager manager = ctx.getNDManager();
        NDArray array;
        if (input.isString()) {
            array = manager.create(input.getStrings());
        } else {
            array = manager.create(input.getFloats(), new Shape(input.getShape()));
        }
        return new NDList(array);
    }

    @Override
    public CanonicalTensor processOutput(TranslatorContext ctx, NDList list) {
        if (list.isEmpty()) {
            throw new IllegalStateException("Model returned no outputs");
        }
        NDArray first = list.get(0);
        long[] shape = first.getShape().getShape();
        if (first.getDataType() == DataType.STRING) {
            return CanonicalTensor.ofStrings(first.toStringArray(), shape);
        }
        if (first.getDataType() != DataType.FLOAT32) {
            first = first.toType(DataType.FLOAT32, false);
        }
        return CanonicalTensor.ofFloats(first.toFloatArray(), shape);
    }

    @Override
    public Batchifier getBatchifier() {
        // callers send batched tensors already
        return null;
    }
}
