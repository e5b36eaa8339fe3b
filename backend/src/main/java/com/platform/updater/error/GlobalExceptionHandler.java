package com.platform.updater.error;

import com.platform.updater.observability.LoggingConfig;
import com.platform.updater.observability.UpdaterMetrics;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 * 
 * Converts exceptions to standardized ErrorResponse.
 * Logs all errors with appropriate severity.
 * Tracks error metrics.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final UpdaterMetrics metrics;
    
    public GlobalExceptionHandler(UpdaterMetrics metrics) {
        this.metrics = metrics;
    }
    
    // ==================== Apply Errors ====================
    
    @ExceptionHandler(ApplyException.class)
    public ResponseEntity<ErrorResponse> handleApply(ApplyException ex, HttpServletRequest request) {
        String traceId = LoggingConfig.currentCorrelationId();
        
        log.error("[{}] Payload apply failed: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("cause", ex.getApplyCause().name());
        if (ex.hasManifest()) {
            metadata.put("kind", ex.getResourceKind().toString());
            metadata.put("namespace", ex.getNamespace());
            metadata.put("name", ex.getName());
            metadata.put("attempts", ex.getAttempts());
        }
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ex.getErrorCode().getCode())
            .message(ex.getMessage())
            .fatal(ex.isFatal())
            .status(HttpStatus.UNPROCESSABLE_ENTITY.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .metadata(metadata)
            .build();
        
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
    }
    
    @ExceptionHandler(ApplyCancelledException.class)
    public ResponseEntity<ErrorResponse> handleCancelled(ApplyCancelledException ex, HttpServletRequest request) {
        return respond(ex, HttpStatus.CONFLICT, request);
    }
    
    @ExceptionHandler(SyncInProgressException.class)
    public ResponseEntity<ErrorResponse> handleSyncInProgress(SyncInProgressException ex, HttpServletRequest request) {
        return respond(ex, HttpStatus.CONFLICT, request);
    }
    
    @ExceptionHandler(PayloadException.class)
    public ResponseEntity<ErrorResponse> handlePayload(PayloadException ex, HttpServletRequest request) {
        HttpStatus status = ex.getErrorCode() == ErrorCode.PAYLOAD_NOT_FOUND
            ? HttpStatus.NOT_FOUND
            : HttpStatus.UNPROCESSABLE_ENTITY;
        return respond(ex, status, request);
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, HttpServletRequest request) {
        String traceId = LoggingConfig.currentCorrelationId();
        
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse.ErrorResponseBuilder builder = ErrorResponse.builder()
            .code(ex.getErrorCode().getCode())
            .message(ex.getMessage())
            .fatal(false)
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
        
        builder.fieldErrors(List.of(
            ErrorResponse.FieldError.builder()
                .field(ex.getField())
                .message(ex.getMessage())
                .rejectedValue(ex.getRejectedValue())
                .build()
        ));
        
        return ResponseEntity.badRequest().body(builder.build());
    }
    
    // ==================== Request Errors ====================
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        
        String traceId = LoggingConfig.currentCorrelationId();
        
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .collect(Collectors.toList());
        
        log.warn("[{}] Validation failed: {} field errors", traceId, fieldErrors.size());
        recordMetric(ErrorCode.MISSING_REQUIRED_FIELD);
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ErrorCode.MISSING_REQUIRED_FIELD.getCode())
            .message("Validation failed")
            .fatal(false)
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .fieldErrors(fieldErrors)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        
        String traceId = LoggingConfig.currentCorrelationId();
        
        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ErrorCode.INVALID_REQUEST.getCode())
            .message("Invalid request body")
            .detail(ex.getMostSpecificCause().getMessage())
            .fatal(false)
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    // ==================== Catch-All ====================
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        String traceId = LoggingConfig.currentCorrelationId();
        
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.INTERNAL_ERROR);
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
            ErrorResponse.of(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred",
                HttpStatus.INTERNAL_SERVER_ERROR.value(), request.getRequestURI(), traceId));
    }
    
    private ResponseEntity<ErrorResponse> respond(UpdaterException ex, HttpStatus status, HttpServletRequest request) {
        String traceId = LoggingConfig.currentCorrelationId();
        
        if (ex.isFatal()) {
            log.error("[{}] {}: {}", traceId, ex.getErrorCode().getCode(), ex.getMessage());
        } else {
            log.warn("[{}] {}: {}", traceId, ex.getErrorCode().getCode(), ex.getMessage());
        }
        recordMetric(ex.getErrorCode());
        
        return ResponseEntity.status(status).body(
            ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), status.value(), request.getRequestURI(), traceId));
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metrics.recordApiError(errorCode.getCode(), errorCode.isFatal());
    }
}
