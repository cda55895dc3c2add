package com.mlhub.server.tools;

import com.mlhub.server.ai.backend.ArtifactInspector;
import com.mlhub.server.ai.backend.ArtifactProfile;
import com.mlhub.server.ai.backend.BackendDetector;
import com.mlhub.server.ai.backend.BackendKind;
import com.mlhub.server.ai.backend.BackendRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Offline tool that reports how the server would treat a model artifact
 * without loading it: the extension guess, what the archive contains and
 * the order backends would be tried in.
 * Usage: ArtifactInspectTool <artifact> [<artifact> ...]
 */
public class ArtifactInspectTool {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactInspectTool.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println("Usage: ArtifactInspectTool <artifact> [<artifact> ...]");
            System.exit(1);
        }

        BackendDetector detector = new BackendDetector();
        ArtifactInspector inspector = new ArtifactInspector();
        // no loaders: only the chain logic is needed
        BackendRegistry registry = new BackendRegistry(List.of(), detector, inspector);

        int missing = 0;
        for (String arg : args) {
            Path path = Paths.get(arg);
            if (!Files.exists(path)) {
                System.err.println("Not found: " + arg);
                missing++;
                continue;
            }
            BackendKind guess = detector.detect(path);
            ArtifactProfile profile = inspector.inspect(path);
            List<BackendKind> chain = registry.candidates(path, profile);
            logger.debug("Inspected {}", path.toAbsolutePath());

            System.out.println(path);
            System.out.println("  extension guess : " + guess + (detector.isRecognized(path) ? "" : " (unrecognized)"));
            System.out.println("  archive format  : " + profile.getFormat());
            if (profile.getTask() != null) {
                System.out.println("  export task     : " + profile.getTask());
            }
            if (!profile.getClassNames().isEmpty()) {
                System.out.println("  classes         : " + profile.getClassNames().size());
            }
            if (profile.getImageSize() > 0) {
                System.out.println("  image size      : " + profile.getImageSize());
            }
            System.out.println("  load order      : " + chain);
        }
        if (missing > 0) {
            System.exit(2);
        }
    }
}
