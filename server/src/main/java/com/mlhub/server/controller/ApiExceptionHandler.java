package com.mlhub.server.controller;

import com.mlhub.server.exception.ArtifactNotFoundException;
import com.mlhub.server.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Not-found and validation failures go back with their cause; anything else
 * is logged in full and answered with a generic message.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String GENERIC_FAILURE = "Prediction failed";

    @ExceptionHandler(ArtifactNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(ArtifactNotFoundException e) {
        logger.warn(e.getMessage());
        return body(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> invalid(ValidationException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        logger.warn("Unreadable request body: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> failed(Exception e) {
        logger.error("Prediction failed", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, GENERIC_FAILURE);
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String detail) {
        return ResponseEntity.status(status).body(Map.of("detail", detail));
    }
}
