package com.mlhub.server.util;

import com.mlhub.server.config.InferenceConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Maps the caller's {@code model_path} onto the local filesystem: applies
 * the first matching prefix rewrite, then resolves relative paths against
 * the model directory.
 */
public class ModelPathResolver {

    private final Path modelDirectory;
    private final Map<String, String> rewrites;

    public ModelPathResolver(InferenceConfig config) {
        String dir = config.modelDirectory != null && !config.modelDirectory.isEmpty() ? config.modelDirectory : ".";
        this.modelDirectory = Paths.get(dir);
        this.rewrites = config.pathRewrites != null ? config.pathRewrites : Map.of();
    }

    public Path resolve(String modelPath) {
        String rewritten = modelPath.trim();
        for (Map.Entry<String, String> rule : rewrites.entrySet()) {
            if (rewritten.startsWith(rule.getKey())) {
                rewritten = rule.getValue() + rewritten.substring(rule.getKey().length());
                break;
            }
        }
        Path path = Paths.get(rewritten);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return modelDirectory.resolve(path).normalize();
    }
}
