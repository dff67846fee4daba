package me.golemcore.hrms.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.hrms.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.hrms.domain.exception.UpstreamServiceException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletionException;

/**
 * Centralized exception handler for web controllers. No stack trace or
 * upstream detail reaches the client.
 */
@ControllerAdvice(basePackages = "me.golemcore.hrms.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    static final String UPSTREAM_FAILURE_MESSAGE = "The assistant is temporarily unavailable. Please try again later.";

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(UpstreamServiceException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleUpstream(UpstreamServiceException ex) {
        log.error("[API] Completion service failure", ex);
        return respond(HttpStatus.BAD_GATEWAY, UPSTREAM_FAILURE_MESSAGE);
    }

    @ExceptionHandler(CompletionException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCompletion(CompletionException ex) {
        if (ex.getCause() instanceof UpstreamServiceException upstream) {
            return handleUpstream(upstream);
        }
        return handleGeneric(ex);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
