package com.mlhub.server.service;

import com.mlhub.server.ai.backend.BackendRegistry;
import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.exception.ArtifactNotFoundException;
import com.mlhub.server.exception.InferenceFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Process-wide model cache. A key is bound to the first handle loaded under
 * it and never rebound or evicted. The first caller for an unseen key loads
 * it; concurrent callers for that key wait for the same load. Failed loads
 * leave no entry behind.
 */
@Service
public class ModelCacheService {

    private static final Logger logger = LoggerFactory.getLogger(ModelCacheService.class);

    private final BackendRegistry registry;
    private final ConcurrentHashMap<String, CompletableFuture<CachedModel>> entries = new ConcurrentHashMap<>();

    public ModelCacheService(BackendRegistry registry) {
        this.registry = registry;
    }

    public static class CachedModel {
        private final String key;
        private final Path path;
        private final BackendHandle handle;
        private final long loadMillis;

        CachedModel(String key, Path path, BackendHandle handle, long loadMillis) {
            this.key = key;
            this.path = path;
            this.handle = handle;
            this.loadMillis = loadMillis;
        }

        public String getKey() {
            return key;
        }

        public Path getPath() {
            return path;
        }

        public BackendHandle getHandle() {
            return handle;
        }

        public long getLoadMillis() {
            return loadMillis;
        }
    }

    public BackendHandle getOrLoad(String key, Path path) {
        if (!Files.exists(path)) {
            throw new ArtifactNotFoundException(path.toString());
        }

        CompletableFuture<CachedModel> existing = entries.get(key);
        if (existing == null) {
            CompletableFuture<CachedModel> pending = new CompletableFuture<>();
            existing = entries.putIfAbsent(key, pending);
            if (existing == null) {
                return load(key, path, pending).getHandle();
            }
        }

        CachedModel cached = await(key, existing);
        if (!cached.getPath().equals(path)) {
            logger.warn("Model key '{}' is pinned to {}; ignoring requested path {}", key, cached.getPath(), path);
        } else {
            logger.debug("Cache HIT for model key '{}'", key);
        }
        return cached.getHandle();
    }

    private CachedModel load(String key, Path path, CompletableFuture<CachedModel> pending) {
        logger.info("Loading model '{}' from {}", key, path);
        long start = System.nanoTime();
        try {
            BackendHandle handle = registry.load(path);
            long elapsed = (System.nanoTime() - start) / 1_000_000;
            CachedModel model = new CachedModel(key, path, handle, elapsed);
            logger.info("Model loaded successfully: key={}, backend={}, inputShape={}, took {} ms", key,
                    handle.getKind(), handle.shape().map(Object::toString).orElse("unknown"), elapsed);
            pending.complete(model);
            return model;
        } catch (RuntimeException | Error e) {
            entries.remove(key, pending);
            pending.completeExceptionally(e);
            throw e;
        }
    }

    private static CachedModel await(String key, CompletableFuture<CachedModel> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InferenceFailureException("Interrupted while waiting for model '" + key + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new InferenceFailureException("Load of model '" + key + "' failed", cause);
        }
    }

    public boolean contains(String key) {
        CompletableFuture<CachedModel> f = entries.get(key);
        return f != null && f.isDone() && !f.isCompletedExceptionally();
    }

    /**
     * Number of keys with a completed load.
     */
    public int size() {
        int n = 0;
        for (CompletableFuture<CachedModel> f : entries.values()) {
            if (f.isDone() && !f.isCompletedExceptionally()) {
                n++;
            }
        }
        return n;
    }
}
