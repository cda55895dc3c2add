package com.mlhub.server.ai.backend;

import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.exception.ModelLoadException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Loader with no engine behind it. Counts and records every load attempt.
 */
public class FakeBackendLoader implements BackendLoader {

    private final BackendKind kind;
    private final boolean available;
    private final BiFunction<Path, ArtifactProfile, BackendHandle> loadFn;
    public final AtomicInteger loads = new AtomicInteger();
    public final List<Path> loadedPaths = Collections.synchronizedList(new ArrayList<>());

    public FakeBackendLoader(BackendKind kind, boolean available,
            BiFunction<Path, ArtifactProfile, BackendHandle> loadFn) {
        this.kind = kind;
        this.available = available;
        this.loadFn = loadFn;
    }

    public static FakeBackendLoader succeeding(BackendKind kind, BackendHandle handle) {
        return new FakeBackendLoader(kind, true, (p, profile) -> handle);
    }

    public static FakeBackendLoader failing(BackendKind kind, String message) {
        return new FakeBackendLoader(kind, true, (p, profile) -> {
            throw new ModelLoadException(kind, message);
        });
    }

    @Override
    public BackendKind getKind() {
        return kind;
    }

    @Override
    public Optional<String> probe() {
        return available ? Optional.of("test-1.0") : Optional.empty();
    }

    @Override
    public BackendHandle load(Path path, ArtifactProfile profile) {
        loads.incrementAndGet();
        loadedPaths.add(path);
        return loadFn.apply(path, profile);
    }
}
