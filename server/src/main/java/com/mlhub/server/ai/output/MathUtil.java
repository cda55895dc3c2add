package com.mlhub.server.ai.output;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class MathUtil {

    /**
     * Returns the index (relative to {@code from}) of the maximum of
     * {@code x[from, from + length)}. Ties resolve to the lowest index.
     */
    public static int argmax(float[] x, int from, int length) {
        int bestIdx = -1;
        float bestVal = Float.NEGATIVE_INFINITY;
        for (int i = 0; i < length; i++) {
            if (bestIdx < 0 || x[from + i] > bestVal) {
                bestVal = x[from + i];
                bestIdx = i;
            }
        }
        return bestIdx;
    }

    /**
     * Indices of the {@code k} largest values of {@code x[from, from + length)},
     * highest first. Equal values keep index order, so the first entry always
     * agrees with {@link #argmax}.
     */
    public static List<Integer> topK(float[] x, int from, int length, int k) {
        List<Integer> idx = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            idx.add(i);
        }
        idx.sort(Comparator.<Integer>comparingDouble(i -> x[from + i]).reversed()
                .thenComparingInt(i -> i));
        return new ArrayList<>(idx.subList(0, Math.min(k, length)));
    }

    /**
     * Rounds half-up to the given number of decimal places.
     */
    public static double round(double value, int places) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value)
                .setScale(places, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
