package com.mlhub.server.ai.backend;

import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.exception.ModelLoadException;
import com.mlhub.server.exception.UnsupportedBackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps backend kinds to their loaders, builds the fallback chain for an
 * artifact and walks it until one loader succeeds. Also owns the capability
 * table reported by the health endpoint.
 */
public class BackendRegistry {

    private static final Logger logger = LoggerFactory.getLogger(BackendRegistry.class);

    private final BackendDetector detector;
    private final ArtifactInspector inspector;
    private final Map<BackendKind, BackendLoader> loaders = new EnumMap<>(BackendKind.class);
    private final Map<BackendKind, BackendCapability> capabilities = new EnumMap<>(BackendKind.class);

    public BackendRegistry(List<BackendLoader> loaders, BackendDetector detector, ArtifactInspector inspector) {
        this.detector = detector;
        this.inspector = inspector;
        for (BackendLoader loader : loaders) {
            BackendLoader previous = this.loaders.put(loader.getKind(), loader);
            if (previous != null) {
                throw new IllegalArgumentException("Two loaders registered for " + loader.getKind());
            }
        }
        for (BackendLoader loader : this.loaders.values()) {
            refreshCapability(loader);
        }
        logger.info("Backend capabilities: {}", capabilities.values());
    }

    /**
     * Candidate kinds for the artifact, in the order they are tried.
     */
    public List<BackendKind> candidates(Path path, ArtifactProfile profile) {
        BackendKind guess = detector.detect(path);
        List<BackendKind> chain = new ArrayList<>();
        if (!detector.isRecognized(path)) {
            chain.add(BackendKind.GRAPH_MODEL);
            chain.add(BackendKind.PORTABLE_GRAPH);
            addDynamicChain(chain, profile);
            return chain;
        }
        switch (guess) {
            case DYNAMIC_MODEL:
            case DETECTION_MODEL:
                addDynamicChain(chain, profile);
                break;
            default:
                chain.add(guess);
        }
        return chain;
    }

    private static void addDynamicChain(List<BackendKind> chain, ArtifactProfile profile) {
        if (profile.isDetectionModel()) {
            chain.add(BackendKind.DETECTION_MODEL);
        }
        chain.add(BackendKind.DYNAMIC_MODEL);
    }

    public BackendHandle load(Path path) {
        BackendKind guess = detector.detect(path);
        boolean recognized = detector.isRecognized(path);
        ArtifactProfile profile = (!recognized || guess == BackendKind.DYNAMIC_MODEL) ? inspector.inspect(path)
                : ArtifactProfile.unknown();
        List<BackendKind> chain = candidates(path, profile);
        logger.debug("Loading {}: guess={}, profile={}, chain={}", path, guess, profile, chain);

        List<String> failures = new ArrayList<>();
        ModelLoadException lastFailure = null;
        for (BackendKind kind : chain) {
            BackendLoader loader = loaders.get(kind);
            if (loader == null) {
                failures.add(kind + ": no loader registered");
                continue;
            }
            if (!capability(kind).isAvailable()) {
                failures.add(kind + ": engine unavailable");
                continue;
            }
            try {
                BackendHandle handle = loader.load(path, profile);
                refreshCapability(loader);
                return handle;
            } catch (ModelLoadException e) {
                logger.warn("{} could not load {}: {}", kind, path.getFileName(), e.getMessage());
                failures.add(kind + ": " + e.getMessage());
                lastFailure = e;
            } catch (RuntimeException e) {
                logger.warn("{} failed unexpectedly on {}", kind, path.getFileName(), e);
                failures.add(kind + ": " + e);
                lastFailure = new ModelLoadException(kind, kind + " could not load " + path.getFileName() + ": " + e,
                        e);
            }
        }

        if (!recognized) {
            throw new UnsupportedBackendException("No backend could load " + path.getFileName() + " " + failures);
        }
        if (chain.size() == 1 && lastFailure != null) {
            throw lastFailure;
        }
        throw new ModelLoadException(guess, "Could not load " + path.getFileName() + " " + failures, lastFailure);
    }

    public BackendCapability capability(BackendKind kind) {
        synchronized (capabilities) {
            BackendCapability cap = capabilities.get(kind);
            return cap != null ? cap : BackendCapability.unavailable(kind);
        }
    }

    /**
     * Framework tag to engine version for every usable backend.
     */
    public Map<String, String> availableBackends() {
        Map<String, String> out = new LinkedHashMap<>();
        synchronized (capabilities) {
            for (BackendCapability cap : capabilities.values()) {
                if (cap.isAvailable()) {
                    out.put(cap.getKind().getFramework(), cap.getVersion());
                }
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private void refreshCapability(BackendLoader loader) {
        Optional<String> version = loader.probe();
        BackendCapability cap = version
                .map(v -> new BackendCapability(loader.getKind(), true, v))
                .orElseGet(() -> BackendCapability.unavailable(loader.getKind()));
        synchronized (capabilities) {
            capabilities.put(loader.getKind(), cap);
        }
    }
}
