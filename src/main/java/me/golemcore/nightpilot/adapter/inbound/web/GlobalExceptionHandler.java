package me.golemcore.nightpilot.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.nightpilot.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.nightpilot.domain.exception.ConcurrencyLimitExceededException;
import me.golemcore.nightpilot.domain.exception.CyclicDependencyException;
import me.golemcore.nightpilot.domain.exception.InvalidScheduleException;
import me.golemcore.nightpilot.domain.exception.JobNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps scheduler exceptions to HTTP responses for the job controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.nightpilot.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidScheduleException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInvalidSchedule(InvalidScheduleException ex) {
        log.warn("[API] Invalid schedule: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(JobNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(JobNotFoundException ex) {
        log.debug("[API] {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(ConcurrencyLimitExceededException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleConcurrencyLimit(ConcurrencyLimitExceededException ex) {
        log.warn("[API] Too many executions: {}", ex.getMessage());
        return respond(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage());
    }

    @ExceptionHandler(CyclicDependencyException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCycle(CyclicDependencyException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

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

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
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
