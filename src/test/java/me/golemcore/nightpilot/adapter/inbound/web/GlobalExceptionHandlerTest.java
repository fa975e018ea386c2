package me.golemcore.nightpilot.adapter.inbound.web;

import me.golemcore.nightpilot.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.nightpilot.domain.exception.ConcurrencyLimitExceededException;
import me.golemcore.nightpilot.domain.exception.CyclicDependencyException;
import me.golemcore.nightpilot.domain.exception.InvalidScheduleException;
import me.golemcore.nightpilot.domain.exception.JobNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldMapInvalidScheduleToBadRequest() {
        assertError(handler.handleInvalidSchedule(new InvalidScheduleException("Invalid cron expression: x")),
                HttpStatus.BAD_REQUEST, "Invalid cron expression: x");
    }

    @Test
    void shouldMapMissingJobToNotFound() {
        JobNotFoundException ex = new JobNotFoundException("job-404");
        assertError(handler.handleNotFound(ex), HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @Test
    void shouldMapConcurrencyLimitToTooManyRequests() {
        assertError(handler.handleConcurrencyLimit(new ConcurrencyLimitExceededException("limit reached", 3)),
                HttpStatus.TOO_MANY_REQUESTS, "limit reached");
    }

    @Test
    void shouldMapCycleToConflict() {
        CyclicDependencyException ex = new CyclicDependencyException("a", "b");
        assertError(handler.handleCycle(ex), HttpStatus.CONFLICT, ex.getMessage());
    }

    @Test
    void shouldKeepResponseStatusReason() {
        assertError(handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be between 1 and 500")),
                HttpStatus.BAD_REQUEST, "limit must be between 1 and 500");
    }

    @Test
    void shouldMapIllegalArgumentToBadRequest() {
        assertError(handler.handleIllegalArgument(new IllegalArgumentException("Job prompt is required")),
                HttpStatus.BAD_REQUEST, "Job prompt is required");
    }

    @Test
    void shouldMapIllegalStateToConflict() {
        assertError(handler.handleIllegalState(new IllegalStateException("Job id already exists")),
                HttpStatus.CONFLICT, "Job id already exists");
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        assertError(handler.handleGeneric(new RuntimeException("secret stack detail")),
                HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static void assertError(Mono<ResponseEntity<ApiErrorResponse>> response, HttpStatus status,
            String message) {
        StepVerifier.create(response)
                .assertNext(entity -> {
                    assertEquals(status, entity.getStatusCode());
                    ApiErrorResponse body = entity.getBody();
                    assertNotNull(body);
                    assertEquals(status.value(), body.getStatus());
                    assertEquals(message, body.getMessage());
                })
                .verifyComplete();
    }
}
