package com.mlhub.server.ai.input;

import com.mlhub.server.exception.ValidationException;

public enum InputKind {
    NUMERIC("numeric"),
    IMAGE("image"),
    CSV("csv"),
    JSON("json"),
    TEXT("text"),
    MULTI_TEXT("multi_text");

    private final String id;

    InputKind(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Null or blank selects {@link #NUMERIC}.
     */
    public static InputKind fromId(String id) {
        if (id == null || id.trim().isEmpty()) {
            return NUMERIC;
        }
        for (InputKind kind : values()) {
            if (kind.id.equalsIgnoreCase(id.trim())) {
                return kind;
            }
        }
        throw new ValidationException("Unknown input_type '" + id + "'");
    }
}
