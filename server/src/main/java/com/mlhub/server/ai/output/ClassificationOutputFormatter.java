package com.mlhub.server.ai.output;

import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.NestedArrays;
import com.mlhub.server.api.PredictResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores along the last axis. Several scores: argmax of the first example,
 * plus the five best when there are more than five. A single score: a
 * probability thresholded at 0.5.
 */
public class ClassificationOutputFormatter implements OutputFormatter {

    static final int TOP_K = 5;
    static final double THRESHOLD = 0.5;

    @Override
    public OutputKind getKind() {
        return OutputKind.CLASSIFICATION;
    }

    @Override
    public void format(CanonicalTensor output, PredictResponse response) {
        response.prediction = NestedArrays.toNestedList(output);
        if (output.isString() || output.size() == 0) {
            return;
        }

        float[] scores = output.getFloats();
        int classes = output.lastAxisLength();
        if (classes > 1) {
            int best = MathUtil.argmax(scores, 0, classes);
            response.predictedClass = best;
            response.confidence = MathUtil.round(scores[best], 4);
            if (classes > TOP_K) {
                List<PredictResponse.ClassScore> top = new ArrayList<>(TOP_K);
                for (int idx : MathUtil.topK(scores, 0, classes, TOP_K)) {
                    top.add(new PredictResponse.ClassScore(idx, MathUtil.round(scores[idx], 4)));
                }
                response.top5 = top;
            }
        } else if (classes == 1) {
            double p = scores[0];
            int predicted = p > THRESHOLD ? 1 : 0;
            response.predictedClass = predicted;
            response.confidence = MathUtil.round(predicted == 1 ? p : 1.0 - p, 4);
        }
    }
}
