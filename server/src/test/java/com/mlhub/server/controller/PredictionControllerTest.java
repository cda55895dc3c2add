package com.mlhub.server.controller;

import com.mlhub.server.ai.backend.ArtifactInspector;
import com.mlhub.server.ai.backend.BackendDetector;
import com.mlhub.server.ai.backend.BackendKind;
import com.mlhub.server.ai.backend.BackendRegistry;
import com.mlhub.server.ai.backend.FakeBackendLoader;
import com.mlhub.server.ai.inference.FakeBackendHandle;
import com.mlhub.server.ai.input.InputNormalizerFactory;
import com.mlhub.server.ai.output.OutputFormatterFactory;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.config.InferenceConfig;
import com.mlhub.server.service.ModelCacheService;
import com.mlhub.server.service.PredictionService;
import com.mlhub.server.util.ModelPathResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class PredictionControllerTest {

    @TempDir
    Path dir;

    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() throws Exception {
        Files.write(dir.resolve("good.onnx"), new byte[] { 1 });
        Files.write(dir.resolve("corrupt.pt"), new byte[] { 1 });

        FakeBackendLoader onnx = FakeBackendLoader.succeeding(BackendKind.PORTABLE_GRAPH,
                FakeBackendHandle.returning(BackendKind.PORTABLE_GRAPH,
                        CanonicalTensor.ofFloats(new float[] { 0.9f, 0.1f }, 1, 2)));
        FakeBackendLoader torch = FakeBackendLoader.failing(BackendKind.DYNAMIC_MODEL, "internal loader detail");

        InferenceConfig config = new InferenceConfig();
        config.modelDirectory = dir.toString();
        BackendRegistry registry = new BackendRegistry(List.of(onnx, torch), new BackendDetector(),
                new ArtifactInspector());
        ModelCacheService cache = new ModelCacheService(registry);
        PredictionService service = new PredictionService(cache, new InputNormalizerFactory(config.image),
                new OutputFormatterFactory(), new ModelPathResolver(config));

        mockMvc = MockMvcBuilders
                .standaloneSetup(new PredictionController(service), new HealthController(cache, registry))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static String body(String path, String key, String extra) {
        return "{\"model_path\": \"" + path + "\", \"model_key\": \"" + key + "\"" + extra + "}";
    }

    @Test
    public void testSuccessfulPrediction() throws Exception {
        mockMvc.perform(post("/predict").contentType(MediaType.APPLICATION_JSON)
                .content(body("good.onnx", "good", ", \"inputs\": [1, 2, 3]")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.predicted_class").value(0))
                .andExpect(jsonPath("$.confidence").value(0.9))
                .andExpect(jsonPath("$.framework").value("onnx"))
                .andExpect(jsonPath("$.top_5").doesNotExist());
    }

    @Test
    public void testMissingArtifactIs404() throws Exception {
        mockMvc.perform(post("/predict").contentType(MediaType.APPLICATION_JSON)
                .content(body("absent.onnx", "absent", ", \"inputs\": [1]")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").exists());
    }

    @Test
    public void testBadPayloadIs400() throws Exception {
        mockMvc.perform(post("/predict").contentType(MediaType.APPLICATION_JSON)
                .content(body("good.onnx", "good", ", \"input_type\": \"image\"")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("image_base64 is required"));

        mockMvc.perform(post("/predict").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void testLoadFailureIsOpaque500() throws Exception {
        mockMvc.perform(post("/predict").contentType(MediaType.APPLICATION_JSON)
                .content(body("corrupt.pt", "corrupt", ", \"inputs\": [1]")))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value(ApiExceptionHandler.GENERIC_FAILURE));
    }

    @Test
    public void testHealth() throws Exception {
        mockMvc.perform(post("/predict").contentType(MediaType.APPLICATION_JSON)
                .content(body("good.onnx", "good", ", \"inputs\": [1, 2]")))
                .andExpect(status().isOk());

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.cached_models").value(1))
                .andExpect(jsonPath("$.backends.onnx").value("test-1.0"))
                .andExpect(jsonPath("$.backends.pytorch").value("test-1.0"));
    }
}
