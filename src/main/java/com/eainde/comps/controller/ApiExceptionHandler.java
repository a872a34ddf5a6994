package com.eainde.comps.controller;

import com.eainde.comps.classify.ClassificationFailureException;
import com.eainde.comps.pipeline.AnalysisTimeoutException;
import com.eainde.comps.pipeline.ExtractionFailureException;
import com.eainde.comps.pipeline.NoUsableFilesException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps request-fatal failures to status codes with a {@code {"detail": ...}} body.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(IllegalArgumentException ex) {
        return detail(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return detail(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(NoUsableFilesException.class)
    public ResponseEntity<Map<String, Object>> handleNoUsableFiles(NoUsableFilesException ex) {
        log.warn("Request rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("detail", ex.getMessage(), "failed_files", ex.getFailedFiles()));
    }

    @ExceptionHandler(ExtractionFailureException.class)
    public ResponseEntity<Map<String, Object>> handleExtractionFailure(ExtractionFailureException ex) {
        log.error("Extraction failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("detail", ex.getMessage(),
                        "failed_files", ex.getFailedFiles(),
                        "incomplete_files", ex.getIncompleteFiles()));
    }

    @ExceptionHandler(ClassificationFailureException.class)
    public ResponseEntity<Map<String, Object>> handleClassificationFailure(ClassificationFailureException ex) {
        log.error("Classification failed", ex);
        return detail(HttpStatus.BAD_GATEWAY, ex.getMessage());
    }

    @ExceptionHandler(AnalysisTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(AnalysisTimeoutException ex) {
        return detail(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> detail(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("detail", message == null ? status.getReasonPhrase() : message));
    }
}
