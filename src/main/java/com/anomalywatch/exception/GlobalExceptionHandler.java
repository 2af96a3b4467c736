package com.anomalywatch.exception;

import com.anomalywatch.dto.ApiError;
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
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        List<ApiError.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ApiError.FieldError.builder()
                .field(fe.getField())
                .rejectedValue(fe.getRejectedValue())
                .message(fe.getDefaultMessage())
                .build())
            .toList();

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed", "VALIDATION_FAILED",
                     "One or more fields failed validation", request, fieldErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Validation Failed", "VALIDATION_FAILED",
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", "TYPE_MISMATCH", msg, request, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "MALFORMED_REQUEST",
                     "Request body could not be read", request, null);
    }

    @ExceptionHandler({
        MalformedQuantileException.class,
        InvalidQuantileIndexException.class,
        DimensionMismatchException.class,
        MissingColumnException.class,
        NonNumericValueException.class,
        InvalidDateException.class,
        DuplicateTimePointException.class,
        EmptyBatchException.class,
        InvalidTransformerConfigException.class,
        InvalidWorkflowException.class,
        BatchSourceException.class
    })
    public ResponseEntity<ApiError> handleBadInput(
            AnomalyWatchException ex, HttpServletRequest request) {
        log.warn("Rejected input | code={} | message={}", ex.getErrorCode(), ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable Input", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(ForecastModelUnavailableException.class)
    public ResponseEntity<ApiError> handleModelUnavailable(
            ForecastModelUnavailableException ex, HttpServletRequest request) {
        log.error("Forecast model unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Forecast Model Unavailable", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(ForecastModelException.class)
    public ResponseEntity<ApiError> handleModelError(
            ForecastModelException ex, HttpServletRequest request) {
        log.error("Forecast model error: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "Forecast Model Error", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
                     "An unexpected error occurred", request, null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String errorCode, String message,
            HttpServletRequest request, List<ApiError.FieldError> fieldErrors) {

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .errorCode(errorCode)
            .message(message)
            .path(request.getRequestURI())
            .requestId(request.getHeader("X-Request-ID"))
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
