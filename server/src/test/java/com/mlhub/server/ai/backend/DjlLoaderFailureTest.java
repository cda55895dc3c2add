package com.mlhub.server.ai.backend;

import ai.djl.repository.zoo.Criteria;
import ai.djl.repository.zoo.ZooModel;
import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.exception.ModelLoadException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

public class DjlLoaderFailureTest {

    /** Loader whose model construction fails with a given error. */
    private static class BrokenLoader extends AbstractDjlLoader {

        private final Supplier<? extends Throwable> error;

        BrokenLoader(Supplier<? extends Throwable> error) {
            super("PyTorch");
            this.error = error;
        }

        @Override
        public BackendKind getKind() {
            return BackendKind.DETECTION_MODEL;
        }

        @Override
        public BackendHandle load(Path path, ArtifactProfile profile) {
            loadModel(null, path.getFileName().toString());
            return null;
        }

        @Override
        protected <I, O> ZooModel<I, O> open(Criteria<I, O> criteria) {
            Throwable t = error.get();
            if (t instanceof RuntimeException) {
                throw (RuntimeException) t;
            }
            throw (Error) t;
        }
    }

    @Test
    public void testTranslatorErrorBecomesLoadFailure() {
        BrokenLoader loader = new BrokenLoader(() -> new IllegalArgumentException("synset missing"));
        ModelLoadException e = assertThrows(ModelLoadException.class,
                () -> loader.load(Path.of("best.pt"), ArtifactProfile.unknown()));
        assertEquals(BackendKind.DETECTION_MODEL, e.getKind());
        assertTrue(e.getMessage().contains("best.pt"), e.getMessage());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    public void testNativeLinkErrorBecomesLoadFailure() {
        BrokenLoader loader = new BrokenLoader(() -> new UnsatisfiedLinkError("libtorch.so"));
        ModelLoadException e = assertThrows(ModelLoadException.class,
                () -> loader.load(Path.of("best.pt"), ArtifactProfile.unknown()));
        assertInstanceOf(UnsatisfiedLinkError.class, e.getCause());
    }
}
