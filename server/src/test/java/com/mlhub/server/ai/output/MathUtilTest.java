package com.mlhub.server.ai.output;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MathUtilTest {

    @Test
    public void testArgmaxWithOffset() {
        float[] x = { 9f, 1f, 3f, 3f, 2f };
        assertEquals(0, MathUtil.argmax(x, 0, 5));
        assertEquals(1, MathUtil.argmax(x, 1, 4), "ties pick the first, relative to the offset");
    }

    @Test
    public void testTopK() {
        float[] x = { 0.1f, 0.5f, 0.3f };
        assertEquals(List.of(1, 2, 0), MathUtil.topK(x, 0, 3, 5));
        assertEquals(List.of(1), MathUtil.topK(x, 0, 3, 1));
    }

    @Test
    public void testRound() {
        assertEquals(0.1235, MathUtil.round(0.12345, 4), 1e-12);
        assertEquals(1.0, MathUtil.round(0.99995, 4), 1e-12);
        assertTrue(Double.isNaN(MathUtil.round(Double.NaN, 4)));
    }
}
