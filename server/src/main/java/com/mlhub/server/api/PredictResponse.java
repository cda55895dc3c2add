package com.mlhub.server.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.mlhub.server.ai.inference.Detection;

import java.util.List;

/**
 * Normalized prediction payload. Fields a formatter does not set are left
 * out of the JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "prediction", "predicted_class", "confidence", "top_5", "value", "image_base64",
        "image_size", "detections", "count", "framework" })
public class PredictResponse {

    @JsonProperty("prediction")
    public Object prediction;

    @JsonProperty("predicted_class")
    public Integer predictedClass;

    @JsonProperty("confidence")
    public Double confidence;

    @JsonProperty("top_5")
    public List<ClassScore> top5;

    /** Scalar for a single regression output, list otherwise. */
    @JsonProperty("value")
    public Object value;

    @JsonProperty("image_base64")
    public String imageBase64;

    @JsonProperty("image_size")
    public ImageSize imageSize;

    @JsonProperty("detections")
    public List<Detection> detections;

    @JsonProperty("count")
    public Integer count;

    @JsonProperty("framework")
    public String framework;

    public static class ClassScore {
        @JsonProperty("class")
        public final int classIndex;

        @JsonProperty("confidence")
        public final double confidence;

        public ClassScore(int classIndex, double confidence) {
            this.classIndex = classIndex;
            this.confidence = confidence;
        }
    }

    public static class ImageSize {
        @JsonProperty("width")
        public final int width;

        @JsonProperty("height")
        public final int height;

        public ImageSize(int width, int height) {
            this.width = width;
            this.height = height;
        }
    }
}
