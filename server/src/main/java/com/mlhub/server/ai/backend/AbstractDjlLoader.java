package com.mlhub.server.ai.backend;

import ai.djl.MalformedModelException;
import ai.djl.engine.Engine;
import ai.djl.engine.EngineException;
import ai.djl.repository.zoo.Criteria;
import ai.djl.repository.zoo.ModelNotFoundException;
import ai.djl.repository.zoo.ZooModel;
import com.mlhub.server.exception.ModelLoadException;

import java.io.IOException;
import java.util.Optional;

/**
 * Engine probing and model construction shared by the DJL-backed loaders.
 * The engine's native library is only pulled in by the first load.
 */
abstract class AbstractDjlLoader implements BackendLoader {

    private final String engineName;
    private volatile boolean acquired;

    protected AbstractDjlLoader(String engineName) {
        this.engineName = engineName;
    }

    protected String getEngineName() {
        return engineName;
    }

    @Override
    public Optional<String> probe() {
        if (!Engine.hasEngine(engineName)) {
            return Optional.empty();
        }
        if (acquired) {
            return Optional.of(Engine.getEngine(engineName).getVersion());
        }
        return Optional.of("djl-" + Engine.getDjlVersion());
    }

    protected <I, O> ZooModel<I, O> loadModel(Criteria<I, O> criteria, String artifactName) {
        try {
            ZooModel<I, O> model = open(criteria);
            acquired = true;
            return model;
        } catch (ModelNotFoundException | MalformedModelException e) {
            throw new ModelLoadException(getKind(), engineName + " rejected " + artifactName + ": " + e.getMessage(),
                    e);
        } catch (IOException e) {
            throw new ModelLoadException(getKind(), "Could not read " + artifactName, e);
        } catch (EngineException e) {
            throw new ModelLoadException(getKind(), engineName + " engine failed on " + artifactName, e);
        } catch (RuntimeException | LinkageError e) {
            // translator factories and native loading fail with arbitrary runtime errors
            throw new ModelLoadException(getKind(), engineName + " could not construct " + artifactName + ": " + e,
                    e);
        }
    }

    protected <I, O> ZooModel<I, O> open(Criteria<I, O> criteria)
            throws ModelNotFoundException, MalformedModelException, IOException {
        return criteria.loadModel();
    }
}
