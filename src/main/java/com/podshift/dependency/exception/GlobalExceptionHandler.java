package com.podshift.dependency.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidSnapshotException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidSnapshot(InvalidSnapshotException ex) {
        log.warn("Rejected snapshot: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "invalid_snapshot", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "validation_failed", details);
    }

    @ExceptionHandler(ResolutionException.class)
    public ResponseEntity<Map<String, Object>> handleResolution(ResolutionException ex) {
        log.error("Dependency resolution failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "resolution_failed", ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("details", details);
        return new ResponseEntity<>(body, status);
    }
}
