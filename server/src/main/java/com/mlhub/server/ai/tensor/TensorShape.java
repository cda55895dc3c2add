package com.mlhub.server.ai.tensor;

import java.util.Arrays;

/**
 * Input shape a backend declares for its first input. Unknown dimensions
 * (dynamic batch, symbolic axes) are stored as -1.
 */
public final class TensorShape {

    public static final long UNKNOWN = -1;

    private final long[] dims;
    private final TensorLayout layout;

    public TensorShape(long[] dims, TensorLayout layout) {
        this.dims = dims.clone();
        for (int i = 0; i < this.dims.length; i++) {
            if (this.dims[i] <= 0) {
                this.dims[i] = UNKNOWN;
            }
        }
        this.layout = layout;
    }

    public int rank() {
        return dims.length;
    }

    public long dim(int axis) {
        return axis < dims.length ? dims[axis] : UNKNOWN;
    }

    public boolean isKnown(int axis) {
        return dim(axis) != UNKNOWN;
    }

    public long[] getDims() {
        return dims.clone();
    }

    public TensorLayout getLayout() {
        return layout;
    }

    @Override
    public String toString() {
        return Arrays.toString(dims) + " " + layout;
    }
}
