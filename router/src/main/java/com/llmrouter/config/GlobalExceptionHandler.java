package com.llmrouter.config;

import com.llmrouter.exception.LlmRoutingException;
import com.llmrouter.exception.NoEligibleProviderException;
import com.llmrouter.exception.ProviderNotFoundException;
import com.llmrouter.exception.ProvidersExhaustedException;
import com.llmrouter.model.AnalysisModels.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .reduce((a, b) -> a + ", " + b)
                .orElse("Validation failed");

        log.warn("Validation error: {}", message);

        return Mono.just(ResponseEntity.badRequest()
                .body(createErrorResponse("invalid_request_error", message, "validation_error")));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInputException(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());

        return Mono.just(ResponseEntity.badRequest()
                .body(createErrorResponse("invalid_request_error",
                        ex.getReason() != null ? ex.getReason() : "Malformed request", "malformed_request")));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Invalid argument: {}", ex.getMessage());

        return Mono.just(ResponseEntity.badRequest()
                .body(createErrorResponse("invalid_request_error", ex.getMessage(), "invalid_argument")));
    }

    @ExceptionHandler(ProviderNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleNotFound(ProviderNotFoundException ex) {
        return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(createErrorResponse("not_found", ex.getMessage(), "provider_not_found")));
    }

    @ExceptionHandler({NoEligibleProviderException.class, ProvidersExhaustedException.class})
    public Mono<ResponseEntity<ErrorResponse>> handleRoutingFailure(LlmRoutingException ex) {
        log.error("Routing failed: {}", ex.getMessage());

        return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(createErrorResponse("service_unavailable", ex.getMessage(), ex.getCategory().getCode())));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(createErrorResponse("server_error", "An unexpected error occurred", "internal_error")));
    }

    private ErrorResponse createErrorResponse(String type, String message, String code) {
        return ErrorResponse.builder()
                .error(ErrorResponse.Error.builder()
                        .type(type)
                        .message(message)
                        .code(code)
                        .build())
                .build();
    }
}
