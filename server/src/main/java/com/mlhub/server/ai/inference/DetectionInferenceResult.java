package com.mlhub.server.ai.inference;

import com.mlhub.server.ai.backend.BackendKind;

import java.util.List;

public class DetectionInferenceResult extends InferenceResult {
    private final List<Detection> detections;
    private final byte[] annotatedPng;
    private final int imageWidth;
    private final int imageHeight;

    public DetectionInferenceResult(List<Detection> detections, byte[] annotatedPng, int imageWidth,
            int imageHeight) {
        super(BackendKind.DETECTION_MODEL, null);
        this.detections = List.copyOf(detections);
        this.annotatedPng = annotatedPng;
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
    }

    public DetectionInferenceResult(List<Detection> detections, int imageWidth, int imageHeight) {
        this(detections, null, imageWidth, imageHeight);
    }

    public List<Detection> getDetections() {
        return detections;
    }

    /**
     * PNG with boxes drawn, only in {@link InferenceMode#ANNOTATED_IMAGE}.
     */
    public byte[] getAnnotatedPng() {
        return annotatedPng;
    }

    public int getImageWidth() {
        return imageWidth;
    }

    public int getImageHeight() {
        return imageHeight;
    }

    @Override
    public boolean isStructured() {
        return true;
    }

    @Override
    public String toString() {
        return "DetectionInferenceResult{" +
                "count=" + detections.size() +
                ", annotated=" + (annotatedPng != null) +
                ", image=" + imageWidth + "x" + imageHeight +
                '}';
    }
}
