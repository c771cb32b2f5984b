package com.todoapi.exception;

import com.todoapi.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResourceNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), null);
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDuplicateResource(DuplicateResourceException ex) {
        log.warn("Duplicate resource: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), null);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleDataIntegrityViolation(DataIntegrityViolationException ex) {
        log.warn("Data integrity violation: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Resource conflicts with existing data", null);
    }

    @ExceptionHandler(AuthenticationFailedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleAuthenticationFailed(AuthenticationFailedException ex) {
        log.warn("Login rejected");
        ErrorResponse error = ErrorResponse.builder()
                .detail(ex.getMessage())
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(error));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        List<ErrorResponse.FieldViolation> violations = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> new ErrorResponse.FieldViolation(error.getField(), error.getDefaultMessage()))
                .collect(Collectors.toList());

        String errors = violations.stream()
                .map(v -> v.getField() + ": " + v.getMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Validation failed: " + errors, violations);
    }

    @ExceptionHandler(InvalidRequestException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInvalidRequest(InvalidRequestException ex) {
        log.warn("Invalid request parameter {}: {}", ex.getField(), ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Validation failed: " + ex.getField() + ": " + ex.getMessage(),
                List.of(new ErrorResponse.FieldViolation(ex.getField(), ex.getMessage())));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleServerWebInput(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Invalid request: " + ex.getReason(), null);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        log.warn("Request failed with status {}: {}", ex.getStatusCode(), ex.getReason());
        ErrorResponse error = ErrorResponse.builder()
                .detail(ex.getReason())
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(ex.getStatusCode()).body(error));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", null);
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String detail,
                                                        List<ErrorResponse.FieldViolation> violations) {
        ErrorResponse error = ErrorResponse.builder()
                .detail(detail)
                .traceId(UUID.randomUUID().toString())
                .errors(violations)
                .build();
        return Mono.just(ResponseEntity.status(status).body(error));
    }
}
