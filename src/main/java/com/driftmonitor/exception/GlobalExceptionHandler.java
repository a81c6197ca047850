package com.driftmonitor.exception;

import com.driftmonitor.config.RequestContextFilter;
import com.driftmonitor.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiError.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_FAILED", "Request validation failed",
                     fieldErrors, null, request, ex);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiError.FieldError> fieldErrors = ex.getConstraintViolations().stream()
            .map(v -> ApiError.FieldError.builder()
                .field(v.getPropertyPath().toString())
                .rejectedValue(v.getInvalidValue())
                .message(v.getMessage())
                .build())
            .toList();
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_FAILED", "Request validation failed",
                     fieldErrors, null, request, ex);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request could not be read",
                     null, null, request, ex);
    }

    @ExceptionHandler(SchemaMismatchException.class)
    public ResponseEntity<ApiError> handleSchemaMismatch(SchemaMismatchException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("missingFromReference", ex.getMissingFromReference());
        details.put("missingFromCurrent", ex.getMissingFromCurrent());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getCode(), ex.getMessage(), null, details, request, ex);
    }

    @ExceptionHandler(EmptySampleException.class)
    public ResponseEntity<ApiError> handleEmptySample(EmptySampleException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, ex.getCode(), ex.getMessage(), null,
                     Map.of("features", ex.getFeatures()), request, ex);
    }

    @ExceptionHandler({InvalidConfigException.class, InvalidSampleException.class, EmptyReportException.class})
    public ResponseEntity<ApiError> handleBadInput(DriftMonitorException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ex.getCode(), ex.getMessage(), null, null, request, ex);
    }

    @ExceptionHandler(PayloadTooLargeException.class)
    public ResponseEntity<ApiError> handleTooLarge(PayloadTooLargeException ex, HttpServletRequest request) {
        return build(HttpStatus.PAYLOAD_TOO_LARGE, ex.getCode(), ex.getMessage(), null, null, request, ex);
    }

    @ExceptionHandler({DriftRunNotFoundException.class, JobNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(DriftMonitorException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, ex.getCode(), ex.getMessage(), null, null, request, ex);
    }

    @ExceptionHandler(RetrainingTriggerException.class)
    public ResponseEntity<ApiError> handleTrigger(RetrainingTriggerException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_GATEWAY, ex.getCode(), ex.getMessage(), null, null, request, ex);
    }

    @ExceptionHandler(RetrainingUnavailableException.class)
    public ResponseEntity<ApiError> handleUnavailable(RetrainingUnavailableException ex, HttpServletRequest request) {
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getCode(), ex.getMessage(), null, null, request, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error | path={} | requestId={}",
                  request.getRequestURI(), RequestContextFilter.requestId(request), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error",
                     null, null, request, null);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String code, String message,
                                           List<ApiError.FieldError> fieldErrors, Map<String, Object> details,
                                           HttpServletRequest request, Exception ex) {
        String requestId = RequestContextFilter.requestId(request);
        ApiError error = ApiError.builder()
            .status(status.value())
            .error(status.getReasonPhrase())
            .code(code)
            .message(message)
            .path(request.getRequestURI())
            .requestId(requestId)
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .details(details)
            .build();
        if (ex != null) {
            log.warn("{} {} -> {} {} | requestId={}", request.getMethod(), request.getRequestURI(),
                     status.value(), code, requestId);
        }
        return ResponseEntity.status(status).body(error);
    }
}
