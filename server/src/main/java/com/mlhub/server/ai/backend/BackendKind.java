package com.mlhub.server.ai.backend;

public enum BackendKind {
    GRAPH_MODEL("graph-model", "tensorflow"),
    DYNAMIC_MODEL("dynamic-model", "pytorch"),
    DETECTION_MODEL("detection-model", "yolo"),
    PORTABLE_GRAPH("portable-graph", "onnx");

    private final String id;
    private final String framework;

    BackendKind(String id, String framework) {
        this.id = id;
        this.framework = framework;
    }

    public String getId() {
        return id;
    }

    /**
     * Tag reported to callers as {@code framework}.
     */
    public String getFramework() {
        return framework;
    }

    @Override
    public String toString() {
        return id;
    }
}
