package com.mlhub.server.ai.tensor;

import java.util.Arrays;

/**
 * An n-dimensional row-major array with an explicit shape. Holds either
 * float32 values or strings; the two never mix.
 */
public final class CanonicalTensor implements ModelInput {

    public enum DataType {
        FLOAT32,
        STRING
    }

    private final DataType dataType;
    private final float[] floats;
    private final String[] strings;
    private final long[] shape;

    private CanonicalTensor(DataType dataType, float[] floats, String[] strings, long[] shape) {
        this.dataType = dataType;
        this.floats = floats;
        this.strings = strings;
        this.shape = shape.clone();
        long expected = elementCount(shape);
        int actual = dataType == DataType.FLOAT32 ? floats.length : strings.length;
        if (expected != actual) {
            throw new IllegalArgumentException(
                    "Shape " + Arrays.toString(shape) + " needs " + expected + " elements, got " + actual);
        }
    }

    public static CanonicalTensor ofFloats(float[] values, long... shape) {
        return new CanonicalTensor(DataType.FLOAT32, values, null, shape);
    }

    public static CanonicalTensor ofStrings(String[] values, long... shape) {
        return new CanonicalTensor(DataType.STRING, null, values, shape);
    }

    public static long elementCount(long[] shape) {
        long n = 1;
        for (long d : shape) {
            if (d < 0) {
                throw new IllegalArgumentException("Negative dimension in " + Arrays.toString(shape));
            }
            n *= d;
        }
        return n;
    }

    public DataType getDataType() {
        return dataType;
    }

    public boolean isString() {
        return dataType == DataType.STRING;
    }

    public long[] getShape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    public long dim(int axis) {
        return shape[axis];
    }

    public int size() {
        return isString() ? strings.length : floats.length;
    }

    /**
     * Length of the innermost axis, or 1 for a scalar.
     */
    public int lastAxisLength() {
        return shape.length == 0 ? 1 : (int) shape[shape.length - 1];
    }

    public float[] getFloats() {
        if (isString()) {
            throw new IllegalStateException("String tensor has no float values");
        }
        return floats;
    }

    public String[] getStrings() {
        if (!isString()) {
            throw new IllegalStateException("Float tensor has no string values");
        }
        return strings;
    }

    public float max() {
        float max = Float.NEGATIVE_INFINITY;
        for (float v : getFloats()) {
            if (v > max) {
                max = v;
            }
        }
        return max;
    }

    public CanonicalTensor reshape(long... newShape) {
        if (isString()) {
            return ofStrings(strings, newShape);
        }
        return ofFloats(floats, newShape);
    }

    /**
     * Promotes a rank-1 tensor of N values to one example of N features.
     */
    public CanonicalTensor withBatchAxisIfVector() {
        if (shape.length == 1) {
            return reshape(1, shape[0]);
        }
        return this;
    }

    /**
     * Rank-4 NHWC to NCHW.
     */
    public CanonicalTensor toChannelsFirst() {
        requireFloatRank(4);
        int n = (int) shape[0];
        int h = (int) shape[1];
        int w = (int) shape[2];
        int c = (int) shape[3];
        float[] out = new float[floats.length];
        for (int b = 0; b < n; b++) {
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    for (int ch = 0; ch < c; ch++) {
                        int src = ((b * h + y) * w + x) * c + ch;
                        int dst = ((b * c + ch) * h + y) * w + x;
                        out[dst] = floats[src];
                    }
                }
            }
        }
        return ofFloats(out, n, c, h, w);
    }

    /**
     * Rank-3 CHW to HWC.
     */
    public CanonicalTensor chwToHwc() {
        requireFloatRank(3);
        int c = (int) shape[0];
        int h = (int) shape[1];
        int w = (int) shape[2];
        float[] out = new float[floats.length];
        for (int ch = 0; ch < c; ch++) {
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    out[(y * w + x) * c + ch] = floats[(ch * h + y) * w + x];
                }
            }
        }
        return ofFloats(out, h, w, c);
    }

    private void requireFloatRank(int expected) {
        if (isString() || shape.length != expected) {
            throw new IllegalStateException(
                    "Expected float tensor of rank " + expected + ", got " + dataType + Arrays.toString(shape));
        }
    }

    @Override
    public String describe() {
        return dataType + Arrays.toString(shape);
    }

    @Override
    public String toString() {
        return "CanonicalTensor{" + describe() + "}";
    }
}
