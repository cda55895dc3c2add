package com.mlhub.server.ai.input;

import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.TensorShape;
import com.mlhub.server.exception.ValidationException;

import java.util.Arrays;

/**
 * Checks a normalized tensor against the input shape a backend declares.
 * Backends without a declared shape accept anything.
 */
final class ShapeChecks {

    private ShapeChecks() {
    }

    /**
     * Rank must match; every declared size past the batch axis must match too.
     */
    static CanonicalTensor requireCompatible(CanonicalTensor tensor, BackendHandle handle, String field) {
        if (handle == null || !handle.shape().isPresent()) {
            return tensor;
        }
        TensorShape declared = handle.shape().get();
        if (declared.rank() != tensor.rank()) {
            throw new ValidationException(field + " has shape " + Arrays.toString(tensor.getShape())
                    + " (rank " + tensor.rank() + ") but the model expects rank " + declared.rank() + " "
                    + declared);
        }
        for (int axis = 1; axis < declared.rank(); axis++) {
            if (declared.isKnown(axis) && declared.dim(axis) != tensor.dim(axis)) {
                throw new ValidationException(field + " has size " + tensor.dim(axis) + " on axis " + axis
                        + " but the model expects " + declared.dim(axis) + " " + declared);
            }
        }
        return tensor;
    }
}
