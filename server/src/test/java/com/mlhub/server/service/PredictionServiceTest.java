package com.mlhub.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlhub.server.ai.backend.ArtifactInspector;
import com.mlhub.server.ai.backend.BackendDetector;
import com.mlhub.server.ai.backend.BackendKind;
import com.mlhub.server.ai.backend.BackendRegistry;
import com.mlhub.server.ai.backend.FakeBackendLoader;
import com.mlhub.server.ai.inference.FakeBackendHandle;
import com.mlhub.server.ai.input.InputNormalizerFactory;
import com.mlhub.server.ai.output.OutputFormatterFactory;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.TensorLayout;
import com.mlhub.server.api.PredictRequest;
import com.mlhub.server.api.PredictResponse;
import com.mlhub.server.config.InferenceConfig;
import com.mlhub.server.exception.ArtifactNotFoundException;
import com.mlhub.server.exception.InferenceFailureException;
import com.mlhub.server.exception.ValidationException;
import com.mlhub.server.util.ModelPathResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PredictionServiceTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeBackendHandle handle;
    private FakeBackendLoader loader;
    private PredictionService service;

    @BeforeEach
    public void setUp() throws Exception {
        Files.write(dir.resolve("iris.onnx"), new byte[] { 1 });
        // three-class softmax stand-in: favours class 2
        handle = new FakeBackendHandle(BackendKind.PORTABLE_GRAPH, null, TensorLayout.CHANNELS_LAST,
                in -> CanonicalTensor.ofFloats(new float[] { 0.1f, 0.2f, 0.7f }, 1, 3));
        loader = FakeBackendLoader.succeeding(BackendKind.PORTABLE_GRAPH, handle);

        InferenceConfig config = new InferenceConfig();
        config.modelDirectory = dir.toString();
        BackendRegistry registry = new BackendRegistry(List.of(loader), new BackendDetector(), new ArtifactInspector());
        service = new PredictionService(new ModelCacheService(registry), new InputNormalizerFactory(config.image),
                new OutputFormatterFactory(), new ModelPathResolver(config));
    }

    private PredictRequest request(String inputType, String outputType) {
        PredictRequest req = new PredictRequest();
        req.modelPath = "iris.onnx";
        req.modelKey = "iris";
        req.inputType = inputType;
        req.outputType = outputType;
        return req;
    }

    @Test
    public void testNumericClassification() throws Exception {
        PredictRequest req = request("numeric", "classification");
        req.inputs = mapper.readTree("[5.1, 3.5, 1.4, 0.2]");

        PredictResponse r = service.predict(req);
        assertEquals(2, r.predictedClass);
        assertEquals(0.7, r.confidence, 1e-6);
        assertEquals("onnx", r.framework);
        assertArrayEquals(new long[] { 1, 4 }, ((CanonicalTensor) handle.lastInput).getShape());
    }

    @Test
    public void testDefaultsToNumericClassification() throws Exception {
        PredictRequest req = request(null, null);
        req.inputs = mapper.readTree("[[1, 2, 3, 4]]");
        assertEquals(2, service.predict(req).predictedClass);
    }

    @Test
    public void testModelLoadedOnceAcrossRequests() throws Exception {
        for (int i = 0; i < 3; i++) {
            PredictRequest req = request("csv", "regression");
            req.csvData = "a,b,c,d\n1,2,3,4";
            assertNotNull(service.predict(req).value);
        }
        assertEquals(1, loader.loads.get());
        assertEquals(3, handle.calls.get());
    }

    @Test
    public void testMissingImageRejectedBeforeLoad() {
        PredictRequest req = request("image", "classification");
        assertThrows(ValidationException.class, () -> service.predict(req));
        assertEquals(0, loader.loads.get());
    }

    @Test
    public void testRequiredFields() throws Exception {
        PredictRequest req = request("numeric", "classification");
        req.inputs = mapper.readTree("[1]");
        req.modelKey = " ";
        ValidationException e = assertThrows(ValidationException.class, () -> service.predict(req));
        assertTrue(e.getMessage().contains("model_key"));

        req.modelKey = "iris";
        req.inputType = "audio";
        assertThrows(ValidationException.class, () -> service.predict(req));
    }

    @Test
    public void testMissingArtifact() throws Exception {
        PredictRequest req = request("numeric", "classification");
        req.modelPath = "nope.onnx";
        req.inputs = mapper.readTree("[1, 2]");
        assertThrows(ArtifactNotFoundException.class, () -> service.predict(req));
    }

    @Test
    public void testBackendErrorsBecomeInferenceFailures() throws Exception {
        Files.write(dir.resolve("broken.onnx"), new byte[] { 1 });
        FakeBackendHandle broken = new FakeBackendHandle(BackendKind.PORTABLE_GRAPH, null,
                TensorLayout.CHANNELS_LAST, in -> {
                    throw new IllegalStateException("shape mismatch");
                });
        loader = FakeBackendLoader.succeeding(BackendKind.PORTABLE_GRAPH, broken);
        InferenceConfig config = new InferenceConfig();
        config.modelDirectory = dir.toString();
        BackendRegistry registry = new BackendRegistry(List.of(loader), new BackendDetector(), new ArtifactInspector());
        PredictionService svc = new PredictionService(new ModelCacheService(registry),
                new InputNormalizerFactory(config.image), new OutputFormatterFactory(), new ModelPathResolver(config));

        PredictRequest req = request("numeric", "classification");
        req.modelPath = "broken.onnx";
        req.modelKey = "broken";
        req.inputs = mapper.readTree("[1, 2]");
        InferenceFailureException e = assertThrows(InferenceFailureException.class, () -> svc.predict(req));
        assertTrue(e.getCause() instanceof IllegalStateException);
    }
}
