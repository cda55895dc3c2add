package com.mlhub.server.ai.output;

import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.api.PredictResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ClassificationOutputFormatterTest {

    private final ClassificationOutputFormatter formatter = new ClassificationOutputFormatter();

    @Test
    public void testTenClassScores() {
        float[] scores = { 0.01f, 0.02f, 0.05f, 0.4f, 0.1f, 0.15f, 0.07f, 0.1f, 0.05f, 0.05f };
        PredictResponse r = new PredictResponse();
        formatter.format(CanonicalTensor.ofFloats(scores, 1, 10), r);

        assertEquals(3, r.predictedClass);
        assertEquals(0.4, r.confidence, 1e-9);
        assertEquals(5, r.top5.size());
        assertEquals(r.predictedClass.intValue(), r.top5.get(0).classIndex);
        assertEquals(r.confidence, r.top5.get(0).confidence, 1e-9);
        // 0.1 ties between 4 and 7 resolve in index order
        assertEquals(5, r.top5.get(1).classIndex);
        assertEquals(4, r.top5.get(2).classIndex);
        assertEquals(7, r.top5.get(3).classIndex);
        assertNotNull(r.prediction);
    }

    @Test
    public void testFewClassesHaveNoTopFive() {
        PredictResponse r = new PredictResponse();
        formatter.format(CanonicalTensor.ofFloats(new float[] { 0.2f, 0.7f, 0.1f }, 1, 3), r);
        assertEquals(1, r.predictedClass);
        assertNull(r.top5);
    }

    @Test
    public void testSingleProbabilityThreshold() {
        PredictResponse high = new PredictResponse();
        formatter.format(CanonicalTensor.ofFloats(new float[] { 0.8f }, 1, 1), high);
        assertEquals(1, high.predictedClass);
        assertEquals(0.8, high.confidence, 1e-6);

        PredictResponse low = new PredictResponse();
        formatter.format(CanonicalTensor.ofFloats(new float[] { 0.2f }, 1, 1), low);
        assertEquals(0, low.predictedClass);
        assertEquals(0.8, low.confidence, 1e-6);

        PredictResponse edge = new PredictResponse();
        formatter.format(CanonicalTensor.ofFloats(new float[] { 0.5f }, 1, 1), edge);
        assertEquals(0, edge.predictedClass);
    }
}
