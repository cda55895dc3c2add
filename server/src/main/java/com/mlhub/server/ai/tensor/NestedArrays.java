package com.mlhub.server.ai.tensor;

import com.fasterxml.jackson.databind.JsonNode;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversions between nested structures (JSON arrays, Java multi-dimensional
 * arrays, nested lists) and flat row-major tensors.
 */
public class NestedArrays {

    /**
     * Reads a rectangular nested JSON array of numbers. A bare number becomes
     * a rank-1 tensor of one value.
     *
     * @throws IllegalArgumentException if the structure is ragged or holds a
     *                                  non-numeric leaf
     */
    public static CanonicalTensor fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new IllegalArgumentException("No data");
        }
        if (node.isNumber()) {
            return CanonicalTensor.ofFloats(new float[] { node.floatValue() }, 1);
        }
        List<Long> shape = new ArrayList<>();
        JsonNode probe = node;
        while (probe.isArray()) {
            shape.add((long) probe.size());
            if (probe.size() == 0) {
                break;
            }
            probe = probe.get(0);
        }
        long[] dims = toArray(shape);
        float[] values = new float[(int) CanonicalTensor.elementCount(dims)];
        int[] cursor = { 0 };
        collect(node, dims, 0, values, cursor);
        return CanonicalTensor.ofFloats(values, dims);
    }

    private static void collect(JsonNode node, long[] dims, int depth, float[] out, int[] cursor) {
        if (depth == dims.length) {
            if (!node.isNumber()) {
                throw new IllegalArgumentException("Non-numeric value '" + node + "'");
            }
            out[cursor[0]++] = node.floatValue();
            return;
        }
        if (!node.isArray() || node.size() != dims[depth]) {
            throw new IllegalArgumentException("Ragged array at depth " + depth);
        }
        for (JsonNode child : node) {
            collect(child, dims, depth + 1, out, cursor);
        }
    }

    /**
     * Flattens a Java multi-dimensional array (e.g. {@code String[][]}) into a
     * string tensor.
     */
    public static CanonicalTensor fromStringArray(Object array) {
        List<Long> shape = new ArrayList<>();
        Object probe = array;
        while (probe != null && probe.getClass().isArray()) {
            int len = Array.getLength(probe);
            shape.add((long) len);
            probe = len > 0 ? Array.get(probe, 0) : null;
        }
        long[] dims = toArray(shape);
        List<String> flat = new ArrayList<>();
        flattenStrings(array, flat);
        return CanonicalTensor.ofStrings(flat.toArray(new String[0]), dims);
    }

    private static void flattenStrings(Object node, List<String> out) {
        if (node != null && node.getClass().isArray()) {
            int len = Array.getLength(node);
            for (int i = 0; i < len; i++) {
                flattenStrings(Array.get(node, i), out);
            }
        } else {
            out.add(node == null ? null : node.toString());
        }
    }

    /**
     * Nested lists mirroring the tensor's shape, ready for JSON output. A
     * rank-0 tensor yields its single value.
     */
    public static Object toNestedList(CanonicalTensor tensor) {
        long[] shape = tensor.getShape();
        int[] cursor = { 0 };
        return nest(tensor, shape, 0, cursor);
    }

    private static Object nest(CanonicalTensor tensor, long[] shape, int depth, int[] cursor) {
        if (depth == shape.length) {
            int i = cursor[0]++;
            return tensor.isString() ? tensor.getStrings()[i] : (Object) tensor.getFloats()[i];
        }
        List<Object> level = new ArrayList<>((int) shape[depth]);
        for (long i = 0; i < shape[depth]; i++) {
            level.add(nest(tensor, shape, depth + 1, cursor));
        }
        return level;
    }

    private static long[] toArray(List<Long> shape) {
        long[] dims = new long[shape.size()];
        for (int i = 0; i < dims.length; i++) {
            dims[i] = shape.get(i);
        }
        return dims;
    }
}
