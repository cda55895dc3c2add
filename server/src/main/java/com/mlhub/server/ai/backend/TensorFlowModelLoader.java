package com.mlhub.server.ai.backend;

import ai.djl.repository.zoo.Criteria;
import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.inference.GraphModelHandle;
import com.mlhub.server.ai.inference.TensorTranslator;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.exception.ModelLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads TensorFlow SavedModels through DJL's TensorFlow engine. Accepts the
 * SavedModel directory or its {@code saved_model.pb}.
 */
public class TensorFlowModelLoader extends AbstractDjlLoader {

    private static final Logger logger = LoggerFactory.getLogger(TensorFlowModelLoader.class);

    public TensorFlowModelLoader() {
        super("TensorFlow");
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.GRAPH_MODEL;
    }

    @Override
    public BackendHandle load(Path path, ArtifactProfile profile) {
        String ext = BackendDetector.extensionOf(path);
        if ("h5".equals(ext) || "keras".equals(ext)) {
            throw new ModelLoadException(getKind(), "Keras archive " + path.getFileName()
                    + " cannot be served directly; export it as a TensorFlow SavedModel directory");
        }
        Path modelDir = path;
        if (Files.isRegularFile(path) && "pb".equals(ext)) {
            modelDir = path.toAbsolutePath().getParent();
        }
        if (!Files.isDirectory(modelDir)) {
            throw new ModelLoadException(getKind(), path.getFileName() + " is not a SavedModel directory");
        }
        logger.debug("Loading SavedModel from {}", modelDir);

        Criteria<CanonicalTensor, CanonicalTensor> criteria = Criteria.builder()
                .setTypes(CanonicalTensor.class, CanonicalTensor.class)
                .optModelPath(modelDir)
                .optEngine(getEngineName())
                .optTranslator(new TensorTranslator())
                .build();
        return new GraphModelHandle(loadModel(criteria, String.valueOf(modelDir.getFileName())));
    }
}
