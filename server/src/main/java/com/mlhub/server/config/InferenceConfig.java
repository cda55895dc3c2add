package com.mlhub.server.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mirrors {@code inference_config.json}. Missing fields keep the defaults
 * below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class InferenceConfig {

    /** Base directory for relative model paths. */
    public String modelDirectory = ".";

    /** Path prefix rewrites applied before resolution, e.g. gateway upload dir to local mount. */
    public Map<String, String> pathRewrites = new LinkedHashMap<>();

    public ImageConfig image = new ImageConfig();
    public DetectionConfig detection = new DetectionConfig();
    public OnnxConfig onnx = new OnnxConfig();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ImageConfig {
        public Integer defaultHeight = 224;
        public Integer defaultWidth = 224;
        public Integer defaultChannels = 3;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DetectionConfig {
        /** Used when the export metadata carries no image size. */
        public Integer imageSize = 640;
        public Double confidenceThreshold = 0.25;
        public Double nmsThreshold = 0.45;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OnnxConfig {
        /** cpu or cuda */
        public String executionProvider = "cpu";
        /** 0 lets the runtime decide. */
        public Integer intraOpThreads = 0;
    }
}
