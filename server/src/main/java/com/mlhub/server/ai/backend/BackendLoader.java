package com.mlhub.server.ai.backend;

import com.mlhub.server.ai.inference.BackendHandle;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Constructs handles for one backend kind.
 */
public interface BackendLoader {

    BackendKind getKind();

    /**
     * Checks whether the backend's engine can be used, without loading any
     * model. Called at startup and again after the first successful load.
     *
     * @return engine version when usable
     */
    Optional<String> probe();

    /**
     * @throws com.mlhub.server.exception.ModelLoadException if the artifact
     *                                                       cannot be
     *                                                       constructed as
     *                                                       this kind
     */
    BackendHandle load(Path path, ArtifactProfile profile);
}
