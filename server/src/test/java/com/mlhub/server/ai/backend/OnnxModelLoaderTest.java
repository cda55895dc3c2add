package com.mlhub.server.ai.backend;

import com.mlhub.server.config.InferenceConfig;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class OnnxModelLoaderTest {

    @Test
    public void testSessionClosedWhenHandleCannotBeBuilt() {
        AtomicInteger closes = new AtomicInteger();
        IllegalStateException failure = new IllegalStateException("no inputs");

        OnnxModelLoader.closeAfterFailure(closes::incrementAndGet, failure);

        assertEquals(1, closes.get());
        assertEquals(0, failure.getSuppressed().length);
    }

    @Test
    public void testCloseErrorKeptAsSuppressed() {
        IllegalStateException failure = new IllegalStateException("no inputs");
        Exception closeError = new Exception("native release failed");

        OnnxModelLoader.closeAfterFailure(() -> {
            throw closeError;
        }, failure);

        assertArrayEquals(new Throwable[] { closeError }, failure.getSuppressed());
    }

    @Test
    public void testKind() {
        OnnxModelLoader loader = new OnnxModelLoader(new InferenceConfig.OnnxConfig());
        assertEquals(BackendKind.PORTABLE_GRAPH, loader.getKind());
    }
}
