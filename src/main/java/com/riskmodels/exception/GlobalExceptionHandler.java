package com.riskmodels.exception;

import com.riskmodels.config.RequestIdFilter;
import com.riskmodels.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
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

        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Failed",
                     "One or more fields failed validation", request, "VALIDATION_FAILED", fieldErrors);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Parameter", ex.getMessage(), request, "VALIDATION_FAILED", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", msg, request, "TYPE_MISMATCH", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request, "BAD_REQUEST", null);
    }

    @ExceptionHandler(ModelNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(
            ModelNotFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({ConcurrentPromotionConflictException.class, InvalidStatusTransitionException.class})
    public ResponseEntity<ApiError> handleConflict(
            ModelLifecycleException ex, HttpServletRequest request) {
        log.warn("Lifecycle conflict | code={} | {}", ex.getErrorCode(), ex.getMessage());
        return build(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({
        InvalidRollbackException.class, InvalidMetricException.class, InvalidAbTestException.class,
        InsufficientDataException.class, InsufficientSamplesException.class, NoBaselineException.class
    })
    public ResponseEntity<ApiError> handleUnprocessable(
            ModelLifecycleException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable Request", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(RegistrationTimeoutException.class)
    public ResponseEntity<ApiError> handleRegistrationTimeout(
            RegistrationTimeoutException ex, HttpServletRequest request) {
        log.error("Registry timeout: {}", ex.getMessage());
        return build(HttpStatus.GATEWAY_TIMEOUT, "Registry Timeout", ex.getMessage(),
                     request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({MlServiceUnavailableException.class, ArtifactStorageException.class})
    public ResponseEntity<ApiError> handleUnavailable(
            ModelLifecycleException ex, HttpServletRequest request) {
        log.error("Dependency unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                     ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler({MlServiceException.class, TrainingFailedException.class})
    public ResponseEntity<ApiError> handleMlError(
            ModelLifecycleException ex, HttpServletRequest request) {
        log.error("ML service error: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "ML Service Error",
                     ex.getMessage(), request, ex.getErrorCode(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(
            Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception at {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                     "An unexpected error occurred", request, "INTERNAL_ERROR", null);
    }

    private ResponseEntity<ApiError> build(
            HttpStatus status, String error, String message,
            HttpServletRequest request, String errorCode,
            List<ApiError.FieldError> fieldErrors) {

        String requestId = MDC.get(RequestIdFilter.MDC_KEY);
        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .errorCode(errorCode)
            .message(message)
            .path(request.getRequestURI())
            .requestId(requestId != null ? requestId : request.getHeader(RequestIdFilter.HEADER))
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
