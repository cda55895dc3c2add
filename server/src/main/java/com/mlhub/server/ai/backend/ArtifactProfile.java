package com.mlhub.server.ai.backend;

import java.util.List;

/**
 * What {@link ArtifactInspector} learned from an artifact's contents.
 */
public class ArtifactProfile {

    public enum Format {
        /** Full TorchScript program (has compiled code). */
        TORCHSCRIPT,
        /** Zip archive holding only tensors, e.g. a saved state dict. */
        WEIGHTS_ONLY,
        /** Not a zip archive; pre-1.6 pickle or an unrelated format. */
        NOT_AN_ARCHIVE,
        /** Not inspected (directories, non-TorchScript extensions). */
        UNKNOWN
    }

    private static final ArtifactProfile UNKNOWN_PROFILE = new ArtifactProfile(Format.UNKNOWN, null, List.of(), 0);

    private final Format format;
    private final String task;
    private final List<String> classNames;
    private final int imageSize;

    public ArtifactProfile(Format format, String task, List<String> classNames, int imageSize) {
        this.format = format;
        this.task = task;
        this.classNames = classNames == null ? List.of() : List.copyOf(classNames);
        this.imageSize = imageSize;
    }

    public static ArtifactProfile unknown() {
        return UNKNOWN_PROFILE;
    }

    public Format getFormat() {
        return format;
    }

    /**
     * Task declared in the export metadata (e.g. "detect"), or null.
     */
    public String getTask() {
        return task;
    }

    /**
     * Class-name table indexed by class id; empty when not exported.
     */
    public List<String> getClassNames() {
        return classNames;
    }

    /**
     * Square input size from export metadata, 0 when absent.
     */
    public int getImageSize() {
        return imageSize;
    }

    public boolean isDetectionModel() {
        return format == Format.TORCHSCRIPT && "detect".equals(task);
    }

    @Override
    public String toString() {
        return "ArtifactProfile{" +
                "format=" + format +
                ", task=" + task +
                ", classes=" + classNames.size() +
                ", imageSize=" + imageSize +
                '}';
    }
}
