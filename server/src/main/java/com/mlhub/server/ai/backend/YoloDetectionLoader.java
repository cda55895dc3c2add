package com.mlhub.server.ai.backend;

import ai.djl.modality.cv.Image;
import ai.djl.modality.cv.output.DetectedObjects;
import ai.djl.modality.cv.translator.YoloV8TranslatorFactory;
import ai.djl.repository.zoo.Criteria;
import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.inference.DetectionModelHandle;
import com.mlhub.server.config.InferenceConfig;
import com.mlhub.server.exception.ModelLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Loads YOLO detectors exported to TorchScript. Only artifacts whose export
 * metadata declares the detect task are accepted, so other TorchScript
 * modules never reach the detection translator.
 */
public class YoloDetectionLoader extends AbstractDjlLoader {

    private static final Logger logger = LoggerFactory.getLogger(YoloDetectionLoader.class);

    private final InferenceConfig.DetectionConfig config;

    public YoloDetectionLoader(InferenceConfig.DetectionConfig config) {
        super("PyTorch");
        this.config = config;
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.DETECTION_MODEL;
    }

    @Override
    public BackendHandle load(Path path, ArtifactProfile profile) {
        if (!profile.isDetectionModel()) {
            throw new ModelLoadException(getKind(), path.getFileName() + " carries no detection export metadata");
        }
        if (profile.getClassNames().isEmpty()) {
            throw new ModelLoadException(getKind(), path.getFileName() + " exports no class names");
        }
        int size = profile.getImageSize() > 0 ? profile.getImageSize() : config.imageSize;
        logger.debug("Loading detector {} at {}px with {} classes", path.getFileName(), size,
                profile.getClassNames().size());

        Criteria<Image, DetectedObjects> criteria = Criteria.builder()
                .setTypes(Image.class, DetectedObjects.class)
                .optModelPath(path)
                .optEngine(getEngineName())
                .optTranslatorFactory(new YoloV8TranslatorFactory())
                .optArgument("width", size)
                .optArgument("height", size)
                .optArgument("resize", true)
                .optArgument("rescale", true)
                .optArgument("optApplyRatio", true)
                .optArgument("threshold", config.confidenceThreshold)
                .optArgument("nmsThreshold", config.nmsThreshold)
                .optArgument("synset", String.join(",", profile.getClassNames()))
                .build();
        return new DetectionModelHandle(loadModel(criteria, String.valueOf(path.getFileName())),
                profile.getClassNames(), size);
    }
}
