package com.mlhub.server.ai.backend;

public class BackendCapability {
    private final BackendKind kind;
    private final boolean available;
    private final String version;

    public BackendCapability(BackendKind kind, boolean available, String version) {
        this.kind = kind;
        this.available = available;
        this.version = version;
    }

    public static BackendCapability unavailable(BackendKind kind) {
        return new BackendCapability(kind, false, null);
    }

    public BackendKind getKind() {
        return kind;
    }

    public boolean isAvailable() {
        return available;
    }

    public String getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return kind + (available ? " " + version : " unavailable");
    }
}
