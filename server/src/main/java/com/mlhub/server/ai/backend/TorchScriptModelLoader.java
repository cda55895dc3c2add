package com.mlhub.server.ai.backend;

import ai.djl.repository.zoo.Criteria;
import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.inference.DynamicModelHandle;
import com.mlhub.server.ai.inference.TensorTranslator;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.exception.ModelLoadException;

import java.nio.file.Path;

/**
 * Loads generic TorchScript modules through DJL's PyTorch engine.
 */
public class TorchScriptModelLoader extends AbstractDjlLoader {

    public TorchScriptModelLoader() {
        super("PyTorch");
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.DYNAMIC_MODEL;
    }

    @Override
    public BackendHandle load(Path path, ArtifactProfile profile) {
        checkLoadable(getKind(), path, profile);
        Criteria<CanonicalTensor, CanonicalTensor> criteria = Criteria.builder()
                .setTypes(CanonicalTensor.class, CanonicalTensor.class)
                .optModelPath(path)
                .optEngine(getEngineName())
                .optTranslator(new TensorTranslator())
                .build();
        return new DynamicModelHandle(loadModel(criteria, String.valueOf(path.getFileName())));
    }

    static void checkLoadable(BackendKind kind, Path path, ArtifactProfile profile) {
        switch (profile.getFormat()) {
            case WEIGHTS_ONLY:
                throw new ModelLoadException(kind, path.getFileName()
                        + ": file contains parameters only, not a full exported model;"
                        + " export it with torch.jit.script or torch.jit.trace");
            case NOT_AN_ARCHIVE:
                throw new ModelLoadException(kind, path.getFileName() + " is not a TorchScript archive");
            default:
                break;
        }
    }
}
