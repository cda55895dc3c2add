package com.mlhub.server.ai.backend;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Guesses the backend from the artifact's file name. This never opens the
 * file; wrong guesses surface when the registry tries to load it.
 */
public class BackendDetector {

    public static final BackendKind DEFAULT_KIND = BackendKind.GRAPH_MODEL;

    private static final Map<String, BackendKind> EXTENSIONS = Map.of(
            "h5", BackendKind.GRAPH_MODEL,
            "keras", BackendKind.GRAPH_MODEL,
            "pb", BackendKind.GRAPH_MODEL,
            "pt", BackendKind.DYNAMIC_MODEL,
            "pth", BackendKind.DYNAMIC_MODEL,
            "torchscript", BackendKind.DYNAMIC_MODEL,
            "onnx", BackendKind.PORTABLE_GRAPH);

    public BackendKind detect(Path path) {
        BackendKind kind = EXTENSIONS.get(extensionOf(path));
        return kind != null ? kind : DEFAULT_KIND;
    }

    /**
     * True when {@link #detect} is based on a known extension (or a SavedModel
     * directory) rather than the default.
     */
    public boolean isRecognized(Path path) {
        return EXTENSIONS.containsKey(extensionOf(path)) || Files.isDirectory(path);
    }

    static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
