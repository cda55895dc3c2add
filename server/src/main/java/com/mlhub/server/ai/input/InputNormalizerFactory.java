package com.mlhub.server.ai.input;

import com.mlhub.server.config.InferenceConfig;

import java.util.EnumMap;
import java.util.Map;

public class InputNormalizerFactory {

    private final Map<InputKind, InputNormalizer> normalizers = new EnumMap<>(InputKind.class);

    public InputNormalizerFactory(InferenceConfig.ImageConfig imageConfig) {
        register(new NumericInputNormalizer());
        register(new ImageInputNormalizer(imageConfig));
        register(new CsvInputNormalizer());
        register(new JsonInputNormalizer());
        register(new TextInputNormalizer());
        register(new MultiTextInputNormalizer());
    }

    private void register(InputNormalizer normalizer) {
        normalizers.put(normalizer.getKind(), normalizer);
    }

    public InputNormalizer forKind(InputKind kind) {
        InputNormalizer normalizer = normalizers.get(kind);
        if (normalizer == null) {
            throw new IllegalStateException("No normalizer for " + kind);
        }
        return normalizer;
    }
}
