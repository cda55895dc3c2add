package com.mlhub.server.ai.backend;

import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.inference.PortableGraphHandle;
import com.mlhub.server.config.InferenceConfig;
import com.mlhub.server.exception.ModelLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Opens ONNX graphs in ONNX Runtime sessions. The runtime environment is
 * acquired on first use and shared by every session.
 */
public class OnnxModelLoader implements BackendLoader {

    private static final Logger logger = LoggerFactory.getLogger(OnnxModelLoader.class);

    private final InferenceConfig.OnnxConfig config;
    private volatile OrtEnvironment env;

    public OnnxModelLoader(InferenceConfig.OnnxConfig config) {
        this.config = config;
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.PORTABLE_GRAPH;
    }

    @Override
    public Optional<String> probe() {
        try {
            environment();
        } catch (OrtException | IllegalStateException | LinkageError e) {
            logger.warn("ONNX Runtime unavailable: {}", e.toString());
            return Optional.empty();
        }
        String version = OrtEnvironment.class.getPackage().getImplementationVersion();
        return Optional.of(version != null ? version : "unknown");
    }

    @Override
    public BackendHandle load(Path path, ArtifactProfile profile) {
        try {
            OrtEnvironment environment = environment();
            OrtSession session;
            try (OrtSession.SessionOptions options = sessionOptions()) {
                session = environment.createSession(path.toString(), options);
            }
            try {
                logger.debug("Opened ONNX session for {} with inputs {}", path.getFileName(),
                        session.getInputNames());
                return new PortableGraphHandle(environment, session);
            } catch (OrtException | RuntimeException e) {
                closeAfterFailure(session, e);
                throw e;
            }
        } catch (OrtException e) {
            throw new ModelLoadException(getKind(), "ONNX Runtime rejected " + path.getFileName() + ": "
                    + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ModelLoadException(getKind(), path.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Releases a resource opened for a handle that could not be built. A
     * failure to close is attached to the original failure.
     */
    static void closeAfterFailure(AutoCloseable resource, Exception failure) {
        try {
            resource.close();
        } catch (Exception closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }

    private OrtEnvironment environment() throws OrtException {
        OrtEnvironment current = env;
        if (current == null) {
            synchronized (this) {
                current = env;
                if (current == null) {
                    current = OrtEnvironment.getEnvironment();
                    env = current;
                }
            }
        }
        return current;
    }

    private OrtSession.SessionOptions sessionOptions() throws OrtException {
        OrtSession.SessionOptions options = new OrtSession.SessionOptions();
        if (config.intraOpThreads != null && config.intraOpThreads > 0) {
            options.setIntraOpNumThreads(config.intraOpThreads);
        }
        String provider = config.executionProvider == null ? "" : config.executionProvider.trim().toLowerCase(Locale.ROOT);
        switch (provider) {
            case "cuda":
                options.addCUDA();
                break;
            default:
                // cpu and anything else use the default provider
                break;
        }
        return options;
    }
}
