package com.mlhub.server.ai.inference;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One detected object. {@code box} is x1, y1, x2, y2 in pixels of the input
 * image.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Detection {

    @JsonProperty("box")
    public final float[] box;

    @JsonProperty("confidence")
    public final double confidence;

    @JsonProperty("class_id")
    public final int classId;

    @JsonProperty("class_name")
    public final String className;

    public Detection(float[] box, double confidence, int classId, String className) {
        this.box = box;
        this.confidence = confidence;
        this.classId = classId;
        this.className = className;
    }
}
