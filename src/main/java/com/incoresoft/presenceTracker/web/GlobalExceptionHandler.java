package com.incoresoft.presenceTracker.web;

import com.incoresoft.presenceTracker.domain.shared.exception.FaceExtractionException;
import com.incoresoft.presenceTracker.domain.shared.exception.IdentityNotFoundException;
import com.incoresoft.presenceTracker.domain.shared.exception.StorageFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        log.warn("Validation failed: {}", message);
        return ResponseEntity.badRequest().body(errorBody("validation_error", message));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<?> handleUnreadable(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorBody("bad_request", "Malformed request: " + ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<?> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorBody("bad_request", ex.getMessage()));
    }

    @ExceptionHandler(IdentityNotFoundException.class)
    public ResponseEntity<?> handleNotFound(IdentityNotFoundException ex) {
        log.warn(ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorBody("not_found", ex.getMessage()));
    }

    @ExceptionHandler(FaceExtractionException.class)
    public ResponseEntity<?> handleExtraction(FaceExtractionException ex) {
        log.warn("Face extraction failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(errorBody("extraction_failure", ex.getMessage()));
    }

    @ExceptionHandler(StorageFailureException.class)
    public ResponseEntity<?> handleStorage(StorageFailureException ex) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("storage_failure", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleAny(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("internal_error", "Unexpected error"));
    }

    private static String describe(FieldError e) {
        return e.getField() + ": " + e.getDefaultMessage();
    }

    private Map<String, Object> errorBody(String code, String message) {
        return Map.of(
                "timestamp", Instant.now().toString(),
                "code", code,
                "message", message == null ? "" : message
        );
    }
}
