package com.mlhub.server.ai.backend;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class BackendDetectorTest {

    private final BackendDetector detector = new BackendDetector();

    @Test
    public void testKnownExtensions() {
        assertEquals(BackendKind.GRAPH_MODEL, detector.detect(Paths.get("m.h5")));
        assertEquals(BackendKind.GRAPH_MODEL, detector.detect(Paths.get("m.keras")));
        assertEquals(BackendKind.GRAPH_MODEL, detector.detect(Paths.get("saved/saved_model.pb")));
        assertEquals(BackendKind.DYNAMIC_MODEL, detector.detect(Paths.get("m.pt")));
        assertEquals(BackendKind.DYNAMIC_MODEL, detector.detect(Paths.get("M.PTH")));
        assertEquals(BackendKind.DYNAMIC_MODEL, detector.detect(Paths.get("m.torchscript")));
        assertEquals(BackendKind.PORTABLE_GRAPH, detector.detect(Paths.get("/a/b/m.onnx")));
    }

    @Test
    public void testUnknownExtensionDefaultsToGraph() {
        Path odd = Paths.get("model.bin");
        assertEquals(BackendKind.GRAPH_MODEL, detector.detect(odd));
        assertFalse(detector.isRecognized(odd));
        assertFalse(detector.isRecognized(Paths.get("model.")));
        assertTrue(detector.isRecognized(Paths.get("model.onnx")));
    }

    @Test
    public void testDirectoryIsSavedModel(@TempDir Path dir) {
        assertEquals(BackendKind.GRAPH_MODEL, detector.detect(dir));
        assertTrue(detector.isRecognized(dir));
    }

    @Test
    public void testFrameworkTags() {
        assertEquals("tensorflow", BackendKind.GRAPH_MODEL.getFramework());
        assertEquals("pytorch", BackendKind.DYNAMIC_MODEL.getFramework());
        assertEquals("yolo", BackendKind.DETECTION_MODEL.getFramework());
        assertEquals("onnx", BackendKind.PORTABLE_GRAPH.getFramework());
        assertEquals("portable-graph", BackendKind.PORTABLE_GRAPH.toString());
    }
}
