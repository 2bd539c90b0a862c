package com.climateforecast.exception;

import com.climateforecast.config.RequestGuardFilter;
import com.climateforecast.dto.ApiError;
import jakarta.servlet.http.HttpServletRequest;
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

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "MALFORMED_REQUEST",
                     "Request body could not be parsed", request, null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String msg = String.format("Parameter '%s' should be of type %s",
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName() : "unknown");
        return build(HttpStatus.BAD_REQUEST, "Type Mismatch", "TYPE_MISMATCH", msg, request, null);
    }

    @ExceptionHandler(InvalidEvaluationConfigException.class)
    public ResponseEntity<ApiError> handleInvalidConfig(
            InvalidEvaluationConfigException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Invalid Evaluation Config", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(UnknownModelException.class)
    public ResponseEntity<ApiError> handleUnknownModel(
            UnknownModelException ex, HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, "Unknown Model", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(InvalidSeriesException.class)
    public ResponseEntity<ApiError> handleInvalidSeries(
            InvalidSeriesException ex, HttpServletRequest request) {
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid Series", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ApiError> handleJobNotFound(
            JobNotFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getErrorCode(),
                     ex.getMessage(), request, null);
    }

    // evaluators record fit failures per fold; one reaching here escaped outside a sweep
    @ExceptionHandler(FitFailureException.class)
    public ResponseEntity<ApiError> handleFitFailure(
            FitFailureException ex, HttpServletRequest request) {
        log.warn("Fit failure outside an evaluation sweep: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Fit Failure", ex.getErrorCode(),
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
            HttpStatus status, String error, String code, String message,
            HttpServletRequest request, List<ApiError.FieldError> fieldErrors) {

        Object assigned = request.getAttribute(RequestGuardFilter.REQUEST_ID_ATTRIBUTE);
        String reqId = assigned instanceof String id ? id
                : request.getHeader(RequestGuardFilter.REQUEST_ID_HEADER);

        ApiError body = ApiError.builder()
            .status(status.value())
            .error(error)
            .code(code)
            .message(message)
            .path(request.getRequestURI())
            .requestId(reqId)
            .timestamp(Instant.now())
            .fieldErrors(fieldErrors)
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
