package com.mlhub.server.ai.inference;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import com.mlhub.server.ai.backend.BackendKind;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.ModelInput;
import com.mlhub.server.ai.tensor.NestedArrays;
import com.mlhub.server.ai.tensor.TensorLayout;
import com.mlhub.server.ai.tensor.TensorShape;
import com.mlhub.server.exception.InferenceFailureException;

import java.nio.DoubleBuffer;
import java.nio.FloatBuffer;
import java.nio.IntBuffer;
import java.nio.LongBuffer;
import java.util.Collections;
import java.util.Iterator;
import java.util.Optional;

/**
 * ONNX graph run through ONNX Runtime. Only the first declared input is
 * bound and only the first output is returned. Sessions allow concurrent
 * {@code run} calls.
 */
public class PortableGraphHandle implements BackendHandle {

    private final OrtEnvironment env;
    private final OrtSession session;
    private final String inputName;
    private final TensorShape shape;

    public PortableGraphHandle(OrtEnvironment env, OrtSession session) throws OrtException {
        this.env = env;
        this.session = session;
        Iterator<String> names = session.getInputNames().iterator();
        if (!names.hasNext()) {
            throw new IllegalArgumentException("Graph declares no inputs");
        }
        this.inputName = names.next();
        NodeInfo info = session.getInputInfo().get(inputName);
        if (info != null && info.getInfo() instanceof TensorInfo) {
            long[] dims = ((TensorInfo) info.getInfo()).getShape();
            this.shape = new TensorShape(dims, layoutFor(dims));
        } else {
            this.shape = null;
        }
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.PORTABLE_GRAPH;
    }

    @Override
    public Optional<TensorShape> shape() {
        return Optional.ofNullable(shape);
    }

    @Override
    public TensorLayout layout() {
        return shape != null ? shape.getLayout() : TensorLayout.CHANNELS_LAST;
    }

    public String getInputName() {
        return inputName;
    }

    @Override
    public InferenceResult infer(ModelInput input, InferenceMode mode) {
        CanonicalTensor tensor = DjlTensorHandle.requireTensor(input);
        try (OnnxTensor onnxInput = toOnnx(tensor);
                OrtSession.Result result = session.run(Collections.singletonMap(inputName, onnxInput))) {
            return new InferenceResult(getKind(), fromOnnx(result.get(0)));
        } catch (OrtException e) {
            throw new InferenceFailureException("ONNX Runtime failed on input '" + inputName + "' "
                    + tensor.describe(), e);
        }
    }

    private OnnxTensor toOnnx(CanonicalTensor tensor) throws OrtException {
        if (tensor.isString()) {
            return OnnxTensor.createTensor(env, tensor.getStrings(), tensor.getShape());
        }
        return OnnxTensor.createTensor(env, FloatBuffer.wrap(tensor.getFloats()), tensor.getShape());
    }

    static CanonicalTensor fromOnnx(OnnxValue value) throws OrtException {
        if (!(value instanceof OnnxTensor)) {
            throw new InferenceFailureException("First output is a " + value.getType() + ", not a tensor");
        }
        OnnxTensor tensor = (OnnxTensor) value;
        TensorInfo info = tensor.getInfo();
        long[] shape = info.getShape();
        switch (info.type) {
            case FLOAT: {
                FloatBuffer buf = tensor.getFloatBuffer();
                float[] out = new float[buf.remaining()];
                buf.get(out);
                return CanonicalTensor.ofFloats(out, shape);
            }
            case DOUBLE: {
                DoubleBuffer buf = tensor.getDoubleBuffer();
                float[] out = new float[buf.remaining()];
                for (int i = 0; i < out.length; i++) {
                    out[i] = (float) buf.get();
                }
                return CanonicalTensor.ofFloats(out, shape);
            }
            case INT64: {
                LongBuffer buf = tensor.getLongBuffer();
                float[] out = new float[buf.remaining()];
                for (int i = 0; i < out.length; i++) {
                    out[i] = buf.get();
                }
                return CanonicalTensor.ofFloats(out, shape);
            }
            case INT32: {
                IntBuffer buf = tensor.getIntBuffer();
                float[] out = new float[buf.remaining()];
                for (int i = 0; i < out.length; i++) {
                    out[i] = buf.get();
                }
                return CanonicalTensor.ofFloats(out, shape);
            }
            case STRING: {
                Object raw = tensor.getValue();
                if (raw instanceof String) {
                    return CanonicalTensor.ofStrings(new String[] { (String) raw }, shape);
                }
                return NestedArrays.fromStringArray(raw);
            }
            default:
                throw new InferenceFailureException("Unsupported output element type " + info.type);
        }
    }

    /**
     * Rank-4 inputs whose second axis looks like a channel count and whose
     * last axis does not are treated as NCHW.
     */
    static TensorLayout layoutFor(long[] dims) {
        if (dims == null || dims.length != 4) {
            return TensorLayout.CHANNELS_LAST;
        }
        boolean secondIsChannel = dims[1] == 1 || dims[1] == 3;
        boolean lastIsChannel = dims[3] == 1 || dims[3] == 3;
        return secondIsChannel && !lastIsChannel ? TensorLayout.CHANNELS_FIRST : TensorLayout.CHANNELS_LAST;
    }
}
