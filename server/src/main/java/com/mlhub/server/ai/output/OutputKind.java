package com.mlhub.server.ai.output;

import com.mlhub.server.exception.ValidationException;

public enum OutputKind {
    CLASSIFICATION("classification"),
    REGRESSION("regression"),
    TEXT("text"),
    IMAGE("image"),
    JSON("json");

    private final String id;

    OutputKind(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Null or blank selects {@link #CLASSIFICATION}.
     */
    public static OutputKind fromId(String id) {
        if (id == null || id.trim().isEmpty()) {
            return CLASSIFICATION;
        }
        for (OutputKind kind : values()) {
            if (kind.id.equalsIgnoreCase(id.trim())) {
                return kind;
            }
        }
        throw new ValidationException("Unknown output_type '" + id + "'");
    }
}
