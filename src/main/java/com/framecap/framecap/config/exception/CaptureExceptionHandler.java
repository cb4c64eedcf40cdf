package com.framecap.framecap.config.exception;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CaptureExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(CaptureExceptionHandler.class);

    @ExceptionHandler(CaptureException.class)
    public ResponseEntity<Map<String, Object>> handleCaptureException(CaptureException e) {
        int status = e.getKind().getHttpStatus().value();
        logger.warn("Request failed with {}: {}", e.getKind(), e.getMessage());

        return ResponseEntity.status(status).body(Map.of(
                "statusCode", status,
                "error", e.getKind().name(),
                "message", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "statusCode", 400,
                "error", "BAD_REQUEST",
                "message", String.valueOf(e.getMessage())));
    }
}
