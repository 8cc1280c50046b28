package com.voxpop.backend.exceptions;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for REST controllers.
 *
 * Every error body carries an {@code error} code, a human-readable {@code message} and a
 * {@code timestamp}; validation errors add the offending {@code field} and per-field {@code details}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        log.warn("Validation failed: {}", ex.getFieldErrors());

        Map<String, Object> response = body("VALIDATION_ERROR", ex.getMessage());
        response.put("field", ex.getField());
        response.put("details", ex.getFieldErrors());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleBeanValidation(MethodArgumentNotValidException ex) {
        Map<String, String> details = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            details.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        log.warn("Request validation failed: {}", details);

        Map<String, Object> response = body("VALIDATION_ERROR",
                details.isEmpty() ? "Invalid request" : details.values().iterator().next());
        response.put("field", details.isEmpty() ? null : details.keySet().iterator().next());
        response.put("details", details);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Rejected transition: {}", ex.getMessage());

        Map<String, Object> response = body("INVALID_TRANSITION", ex.getMessage());
        response.put("contactId", ex.getContactId());
        response.put("contactStatus", ex.getCurrentStatus());
        response.put("transition", ex.getTransition().getValue());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(SegmentInUseException.class)
    public ResponseEntity<Map<String, Object>> handleSegmentInUse(SegmentInUseException ex) {
        log.warn("Segment delete blocked: {}", ex.getMessage());

        Map<String, Object> response = body("SEGMENT_IN_USE", ex.getMessage());
        response.put("segmentId", ex.getSegmentId());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(TagDeletionBlockedException.class)
    public ResponseEntity<Map<String, Object>> handleTagDeletionBlocked(TagDeletionBlockedException ex) {
        log.warn("Tag delete blocked: {}", ex.getMessage());

        Map<String, Object> response = body("TAG_DELETE_BLOCKED", ex.getMessage());
        response.put("tagId", ex.getTagId());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());

        Map<String, Object> response = body("NOT_FOUND", ex.getMessage());
        response.put("resource", ex.getResourceType());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        log.warn("Upload rejected: {}", ex.getMessage());

        Map<String, Object> response = body("VALIDATION_ERROR", "File too large");
        response.put("field", "file");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "An unexpected error occurred"));
    }

    private Map<String, Object> body(String error, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("error", error);
        response.put("message", message);
        response.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC));
        return response;
    }
}
