package com.eyelevel.uploadengine.exception.handler;

import com.eyelevel.uploadengine.dto.common.ApiResponse;
import com.eyelevel.uploadengine.exception.api.BadGatewayException;
import com.eyelevel.uploadengine.exception.api.BadRequestException;
import com.eyelevel.uploadengine.exception.api.ConflictException;
import com.eyelevel.uploadengine.exception.api.NotFoundException;
import com.eyelevel.uploadengine.exception.api.ServiceUnavailableException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A centralized exception handler for the entire application.
 * It intercepts exceptions thrown from controllers and converts them into a
 * standardized ApiResponse format with the semantically correct HTTP status code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    /**
     * Handles rejected operations such as an invalid failover target. (400 Bad Request)
     */
    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(BadRequestException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error(ex.getMessage(), ex.getStatusCode()));
    }

    /**
     * Handles malformed JSON or unreadable request bodies. (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Handling HttpMessageNotReadableException: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ApiResponse.error("Malformed request body.",
                "The request body is missing or could not be parsed.", HttpStatus.BAD_REQUEST.value()));
    }

    /**
     * Handles validation errors from @Valid on request bodies. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> String.format("'%s': %s", error.getField(), error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling validation exception: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST,
                ApiResponse.error("Invalid input provided.", errorMessage, HttpStatus.BAD_REQUEST.value()));
    }

    /**
     * Handles validation errors on path variables and request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(ConstraintViolationException ex) {
        String errors = ex.getConstraintViolations().stream()
                .map(violation -> String.format("'%s': %s",
                        // Extracts the parameter name from the property path
                        violation.getPropertyPath().toString().substring(violation.getPropertyPath().toString().lastIndexOf('.') + 1),
                        violation.getMessage()))
                .collect(Collectors.joining(", "));
        String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST,
                ApiResponse.error("Invalid input provided.", errorMessage, HttpStatus.BAD_REQUEST.value()));
    }

    /**
     * Handles type mismatch errors for path variables or request parameters. (400 Bad Request)
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String errorMessage = String.format("Invalid value '%s' for parameter '%s'. Expected type '%s'.", ex.getValue(),
                ex.getName(), ex.getRequiredType() != null
                        ? ex.getRequiredType().getSimpleName()
                        : String.valueOf(ex.getRequiredType()));
        log.warn("Handling type mismatch exception: {}", errorMessage);
        return respond(HttpStatus.BAD_REQUEST,
                ApiResponse.error("Invalid parameter type provided.", errorMessage, HttpStatus.BAD_REQUEST.value()));
    }

    /**
     * Handles unknown provider ids. (404 Not Found)
     */
    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNotFound(NotFoundException ex) {
        log.warn("Resource Not Found Exception: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ApiResponse.error(ex.getMessage(), ex.getStatusCode()));
    }

    /**
     * Handles unsupported HTTP methods for an existing endpoint. (405 Method Not Allowed)
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        String supportedMethods = String.join(", ", Objects.requireNonNull(ex.getSupportedMethods()));
        String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s", ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return respond(HttpStatus.METHOD_NOT_ALLOWED,
                ApiResponse.error("Method not allowed.", errorMessage, HttpStatus.METHOD_NOT_ALLOWED.value()));
    }

    /**
     * Handles duplicate provider registration. (409 Conflict)
     */
    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiResponse<Object>> handleConflict(ConflictException ex) {
        log.warn("Conflict Exception: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ApiResponse.error(ex.getMessage(), ex.getStatusCode()));
    }

    // --- 5xx Server Error Handlers ---

    /**
     * Handles uploads that every tried provider rejected. (502 Bad Gateway)
     */
    @ExceptionHandler(BadGatewayException.class)
    public ResponseEntity<ApiResponse<Object>> handleBadGateway(BadGatewayException ex) {
        log.error("Bad Gateway Exception: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ApiResponse.error(ex.getMessage(), ex.getStatusCode()));
    }

    /**
     * Handles requests that arrive while no provider is healthy. (503 Service Unavailable)
     */
    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<ApiResponse<Object>> handleServiceUnavailable(ServiceUnavailableException ex) {
        log.error("Service Unavailable Exception: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ApiResponse.error(ex.getMessage(), ex.getStatusCode()));
    }

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ApiResponse.error(
                "An unexpected internal error occurred. Please contact support.", ex.getClass().getSimpleName(),
                HttpStatus.INTERNAL_SERVER_ERROR.value()));
    }

    private static ResponseEntity<ApiResponse<Object>> respond(HttpStatus status, ApiResponse<Object> body) {
        return new ResponseEntity<>(body, status);
    }
}
