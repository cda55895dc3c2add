package com.mlhub.server.config;

import com.mlhub.server.ai.backend.ArtifactInspector;
import com.mlhub.server.ai.backend.BackendDetector;
import com.mlhub.server.ai.backend.BackendLoader;
import com.mlhub.server.ai.backend.BackendRegistry;
import com.mlhub.server.ai.backend.OnnxModelLoader;
import com.mlhub.server.ai.backend.TensorFlowModelLoader;
import com.mlhub.server.ai.backend.TorchScriptModelLoader;
import com.mlhub.server.ai.backend.YoloDetectionLoader;
import com.mlhub.server.ai.input.InputNormalizerFactory;
import com.mlhub.server.ai.output.OutputFormatterFactory;
import com.mlhub.server.util.ModelPathResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the framework-independent core. None of these classes know about
 * Spring.
 */
@Configuration
public class InferenceBeans {

    @Bean
    public InferenceConfig inferenceConfig() {
        return InferenceConfigLoader.load();
    }

    @Bean
    public ModelPathResolver modelPathResolver(InferenceConfig config) {
        return new ModelPathResolver(config);
    }

    @Bean
    public BackendRegistry backendRegistry(InferenceConfig config) {
        List<BackendLoader> loaders = List.of(
                new TensorFlowModelLoader(),
                new TorchScriptModelLoader(),
                new YoloDetectionLoader(config.detection),
                new OnnxModelLoader(config.onnx));
        return new BackendRegistry(loaders, new BackendDetector(), new ArtifactInspector());
    }

    @Bean
    public InputNormalizerFactory inputNormalizerFactory(InferenceConfig config) {
        return new InputNormalizerFactory(config.image);
    }

    @Bean
    public OutputFormatterFactory outputFormatterFactory() {
        return new OutputFormatterFactory();
    }
}
