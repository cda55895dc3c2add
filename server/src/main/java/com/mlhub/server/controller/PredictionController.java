package com.mlhub.server.controller;

import com.mlhub.server.api.PredictRequest;
import com.mlhub.server.api.PredictResponse;
import com.mlhub.server.service.PredictionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PredictionController {

    private static final Logger logger = LoggerFactory.getLogger(PredictionController.class);
    private final PredictionService predictionService;

    public PredictionController(PredictionService predictionService) {
        this.predictionService = predictionService;
    }

    @PostMapping("/predict")
    public ResponseEntity<PredictResponse> predict(@RequestBody PredictRequest request) {
        logger.info("Received prediction request: key={}, input={}, output={}",
                request.modelKey, request.inputType, request.outputType);
        return ResponseEntity.ok(predictionService.predict(request));
    }
}
