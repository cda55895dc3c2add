package com.mlhub.server.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PredictRequest {

    @JsonProperty("model_path")
    public String modelPath;

    @JsonProperty("model_key")
    public String modelKey;

    @JsonProperty("input_type")
    public String inputType;

    @JsonProperty("output_type")
    public String outputType;

    /** numeric: flat or nested numbers */
    @JsonProperty("inputs")
    public JsonNode inputs;

    @JsonProperty("image_base64")
    public String imageBase64;

    @JsonProperty("text")
    public String text;

    @JsonProperty("texts")
    public List<String> texts;

    @JsonProperty("csv_data")
    public String csvData;

    @JsonProperty("json_data")
    public JsonNode jsonData;
}
