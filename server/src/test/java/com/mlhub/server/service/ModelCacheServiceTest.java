package com.mlhub.server.service;

import com.mlhub.server.ai.backend.ArtifactInspector;
import com.mlhub.server.ai.backend.BackendDetector;
import com.mlhub.server.ai.backend.BackendKind;
import com.mlhub.server.ai.backend.BackendRegistry;
import com.mlhub.server.ai.backend.FakeBackendLoader;
import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.inference.FakeBackendHandle;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.exception.ArtifactNotFoundException;
import com.mlhub.server.exception.ModelLoadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

public class ModelCacheServiceTest {

    @TempDir
    Path dir;

    private static BackendRegistry registry(FakeBackendLoader loader) {
        return new BackendRegistry(List.of(loader), new BackendDetector(), new ArtifactInspector());
    }

    private static BackendHandle onnxHandle() {
        return FakeBackendHandle.returning(BackendKind.PORTABLE_GRAPH, CanonicalTensor.ofFloats(new float[] { 0f }, 1));
    }

    @Test
    public void testKeyIsPinnedToFirstLoad() throws Exception {
        Path first = Files.write(dir.resolve("a.onnx"), new byte[] { 1 });
        Path second = Files.write(dir.resolve("b.onnx"), new byte[] { 2 });
        FakeBackendLoader loader = new FakeBackendLoader(BackendKind.PORTABLE_GRAPH, true, (p, prof) -> onnxHandle());
        ModelCacheService cache = new ModelCacheService(registry(loader));

        BackendHandle h1 = cache.getOrLoad("model", first);
        BackendHandle h2 = cache.getOrLoad("model", second);
        assertSame(h1, h2);
        assertEquals(1, loader.loads.get());
        assertEquals(List.of(first), loader.loadedPaths);
        assertTrue(cache.contains("model"));
        assertEquals(1, cache.size());
    }

    @Test
    public void testMissingPathIsNotFoundEvenForCachedKey() throws Exception {
        Path real = Files.write(dir.resolve("a.onnx"), new byte[] { 1 });
        FakeBackendLoader loader = FakeBackendLoader.succeeding(BackendKind.PORTABLE_GRAPH, onnxHandle());
        ModelCacheService cache = new ModelCacheService(registry(loader));
        cache.getOrLoad("model", real);

        Path missing = dir.resolve("gone.onnx");
        assertThrows(ArtifactNotFoundException.class, () -> cache.getOrLoad("model", missing));
        assertThrows(ArtifactNotFoundException.class, () -> cache.getOrLoad("other", missing));
        assertEquals(1, loader.loads.get());
    }

    @Test
    public void testFailedLoadIsNotCached() throws Exception {
        Path path = Files.write(dir.resolve("a.onnx"), new byte[] { 1 });
        AtomicBoolean fail = new AtomicBoolean(true);
        FakeBackendLoader loader = new FakeBackendLoader(BackendKind.PORTABLE_GRAPH, true, (p, prof) -> {
            if (fail.get()) {
                throw new ModelLoadException(BackendKind.PORTABLE_GRAPH, "corrupt");
            }
            return onnxHandle();
        });
        ModelCacheService cache = new ModelCacheService(registry(loader));

        assertThrows(ModelLoadException.class, () -> cache.getOrLoad("model", path));
        assertFalse(cache.contains("model"));
        assertEquals(0, cache.size());

        fail.set(false);
        assertNotNull(cache.getOrLoad("model", path));
        assertEquals(2, loader.loads.get());
    }

    @Test
    public void testConcurrentCallersShareOneLoad() throws Exception {
        Path path = Files.write(dir.resolve("a.onnx"), new byte[] { 1 });
        CountDownLatch loadStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FakeBackendLoader loader = new FakeBackendLoader(BackendKind.PORTABLE_GRAPH, true, (p, prof) -> {
            loadStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return onnxHandle();
        });
        ModelCacheService cache = new ModelCacheService(registry(loader));

        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<BackendHandle>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> cache.getOrLoad("shared", path)));
            }
            assertTrue(loadStarted.await(5, TimeUnit.SECONDS));
            Thread.sleep(100);
            release.countDown();

            BackendHandle first = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<BackendHandle> f : results) {
                assertSame(first, f.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, loader.loads.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void testWaitersSeeTheLoadFailure() throws Exception {
        Path path = Files.write(dir.resolve("a.onnx"), new byte[] { 1 });
        CountDownLatch loadStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FakeBackendLoader loader = new FakeBackendLoader(BackendKind.PORTABLE_GRAPH, true, (p, prof) -> {
            loadStarted.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new ModelLoadException(BackendKind.PORTABLE_GRAPH, "corrupt");
        });
        ModelCacheService cache = new ModelCacheService(registry(loader));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<BackendHandle> loaderCall = pool.submit(() -> cache.getOrLoad("k", path));
            assertTrue(loadStarted.await(5, TimeUnit.SECONDS));
            Future<BackendHandle> waiter = pool.submit(() -> cache.getOrLoad("k", path));
            Thread.sleep(100);
            release.countDown();

            ExecutionException e1 = assertThrows(ExecutionException.class,
                    () -> loaderCall.get(5, TimeUnit.SECONDS));
            assertTrue(e1.getCause() instanceof ModelLoadException);
            ExecutionException e2 = assertThrows(ExecutionException.class,
                    () -> waiter.get(5, TimeUnit.SECONDS));
            assertTrue(e2.getCause() instanceof ModelLoadException);
            assertFalse(cache.contains("k"));
        } finally {
            pool.shutdownNow();
        }
    }
}
