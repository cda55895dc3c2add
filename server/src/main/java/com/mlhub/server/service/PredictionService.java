package com.mlhub.server.service;

import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.inference.DetectionInferenceResult;
import com.mlhub.server.ai.inference.InferenceMode;
import com.mlhub.server.ai.inference.InferenceResult;
import com.mlhub.server.ai.input.InputKind;
import com.mlhub.server.ai.input.InputNormalizer;
import com.mlhub.server.ai.input.InputNormalizerFactory;
import com.mlhub.server.ai.output.OutputFormatterFactory;
import com.mlhub.server.ai.output.OutputKind;
import com.mlhub.server.ai.tensor.ModelInput;
import com.mlhub.server.api.PredictRequest;
import com.mlhub.server.api.PredictResponse;
import com.mlhub.server.exception.InferenceFailureException;
import com.mlhub.server.exception.InferenceServiceException;
import com.mlhub.server.exception.ValidationException;
import com.mlhub.server.util.ModelPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Base64;

/**
 * Runs one prediction: validate the payload, load or fetch the model,
 * normalize the input for that model, infer, format.
 */
@Service
public class PredictionService {

    private static final Logger logger = LoggerFactory.getLogger(PredictionService.class);

    private final ModelCacheService modelCache;
    private final InputNormalizerFactory normalizers;
    private final OutputFormatterFactory formatters;
    private final ModelPathResolver pathResolver;

    public PredictionService(ModelCacheService modelCache, InputNormalizerFactory normalizers,
            OutputFormatterFactory formatters, ModelPathResolver pathResolver) {
        this.modelCache = modelCache;
        this.normalizers = normalizers;
        this.formatters = formatters;
        this.pathResolver = pathResolver;
    }

    public PredictResponse predict(PredictRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        requireField(request.modelPath, "model_path");
        requireField(request.modelKey, "model_key");
        InputKind inputKind = InputKind.fromId(request.inputType);
        OutputKind outputKind = OutputKind.fromId(request.outputType);

        // payload problems are reported before any model is loaded
        InputNormalizer normalizer = normalizers.forKind(inputKind);
        normalizer.validate(request);

        Path path = pathResolver.resolve(request.modelPath);
        BackendHandle handle = modelCache.getOrLoad(request.modelKey, path);

        ModelInput input = normalizer.normalize(request, handle);
        logger.debug("Model '{}' ({}): {} input normalized to {}", request.modelKey, handle.getKind(),
                inputKind.getId(), input.describe());

        InferenceMode mode = outputKind == OutputKind.IMAGE ? InferenceMode.ANNOTATED_IMAGE : InferenceMode.STANDARD;
        InferenceResult result = infer(handle, input, mode, request.modelKey);

        PredictResponse response = new PredictResponse();
        if (result instanceof DetectionInferenceResult) {
            formatDetections((DetectionInferenceResult) result, response);
        } else {
            formatters.forKind(outputKind).format(result.getTensor(), response);
        }
        response.framework = handle.getKind().getFramework();
        return response;
    }

    private static InferenceResult infer(BackendHandle handle, ModelInput input, InferenceMode mode, String key) {
        try {
            return handle.infer(input, mode);
        } catch (InferenceServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InferenceFailureException("Model '" + key + "' (" + handle.getKind() + ") failed on "
                    + input.describe(), e);
        }
    }

    /**
     * Detection results are already structured and skip the output
     * formatters.
     */
    private static void formatDetections(DetectionInferenceResult result, PredictResponse response) {
        response.detections = result.getDetections();
        response.count = result.getDetections().size();
        response.prediction = result.getDetections();
        if (result.getAnnotatedPng() != null) {
            response.imageBase64 = Base64.getEncoder().encodeToString(result.getAnnotatedPng());
            response.imageSize = new PredictResponse.ImageSize(result.getImageWidth(), result.getImageHeight());
        }
    }

    private static void requireField(String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            throw new ValidationException(name + " is required");
        }
    }
}
