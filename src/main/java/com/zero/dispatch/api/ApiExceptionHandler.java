package com.zero.dispatch.api;

import com.zero.core.cache.ConflictingRunException;
import com.zero.core.profile.UnknownProfileException;
import com.zero.core.queue.JobAlreadyTerminalException;
import com.zero.core.queue.JobNotFoundException;
import com.zero.core.queue.QueueFullException;
import com.zero.core.registry.UnknownAnalyzerException;
import com.zero.core.scheduler.CycleDetectedException;
import com.zero.core.scheduler.UnknownDependencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps domain exceptions to HTTP status codes and a uniform {@link ErrorResponse} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({UnknownAnalyzerException.class, UnknownProfileException.class,
            UnknownDependencyException.class})
    public ResponseEntity<ErrorResponse> unknown(RuntimeException e) {
        return respond(HttpStatus.BAD_REQUEST, "unknown_reference", e);
    }

    @ExceptionHandler(CycleDetectedException.class)
    public ResponseEntity<ErrorResponse> cycle(CycleDetectedException e) {
        return respond(HttpStatus.BAD_REQUEST, "dependency_cycle", e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", e);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> unreadable(Exception e) {
        log.debug("Malformed request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("bad_request", "Malformed request: " + e.getMessage()));
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(JobNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "not_found", e);
    }

    @ExceptionHandler(JobAlreadyTerminalException.class)
    public ResponseEntity<ErrorResponse> alreadyTerminal(JobAlreadyTerminalException e) {
        return respond(HttpStatus.CONFLICT, "already_terminal", e);
    }

    @ExceptionHandler(ConflictingRunException.class)
    public ResponseEntity<ErrorResponse> conflictingRun(ConflictingRunException e) {
        return respond(HttpStatus.CONFLICT, "conflicting_run", e);
    }

    @ExceptionHandler(QueueFullException.class)
    public ResponseEntity<ErrorResponse> queueFull(QueueFullException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "queue_full", e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        // Spring MVC's own failures (missing parameter, unknown route) carry their status
        if (e instanceof org.springframework.web.ErrorResponse mvcError) {
            HttpStatus status = HttpStatus.resolve(mvcError.getStatusCode().value());
            String error = status != null && status.is4xxClientError() ? "bad_request" : "internal_error";
            if (status == HttpStatus.NOT_FOUND) {
                error = "not_found";
            }
            return ResponseEntity.status(mvcError.getStatusCode()).body(ErrorResponse.of(error, e.getMessage()));
        }
        log.error("Unhandled API error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("internal_error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, RuntimeException e) {
        log.debug("{} -> {}: {}", e.getClass().getSimpleName(), status.value(), e.getMessage());
        return ResponseEntity.status(status).body(ErrorResponse.of(error, e.getMessage()));
    }
}
