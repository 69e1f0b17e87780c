package com.shlawgathon.sentientloop.backend.controller;

import com.shlawgathon.sentientloop.backend.dto.ApiErrorResponse;
import com.shlawgathon.sentientloop.backend.dto.CheckpointResponse;
import com.shlawgathon.sentientloop.backend.exception.AlreadyResolvedException;
import com.shlawgathon.sentientloop.backend.exception.ExternalDependencyException;
import com.shlawgathon.sentientloop.backend.exception.GovernanceValidationException;
import com.shlawgathon.sentientloop.backend.exception.InvalidTransitionException;
import com.shlawgathon.sentientloop.backend.exception.NotFoundException;
import com.shlawgathon.sentientloop.backend.exception.OperationFailedException;
import com.shlawgathon.sentientloop.backend.exception.PolicyVersionConflictException;
import com.shlawgathon.sentientloop.backend.exception.RecoveryInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;

/**
 * Maps governance exceptions to HTTP statuses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(NotFoundException e) {
        return respond(error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage()).build());
    }

    @ExceptionHandler(AlreadyResolvedException.class)
    public ResponseEntity<ApiErrorResponse> handleAlreadyResolved(AlreadyResolvedException e) {
        log.info("[API] {}", e.getMessage());
        return respond(error(HttpStatus.CONFLICT, "ALREADY_RESOLVED", e.getMessage())
                .current(CheckpointResponse.from(e.getCurrent()))
                .build());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidTransition(InvalidTransitionException e) {
        log.info("[API] {}", e.getMessage());
        return respond(error(HttpStatus.CONFLICT, "INVALID_TRANSITION", e.getMessage()).build());
    }

    @ExceptionHandler(RecoveryInProgressException.class)
    public ResponseEntity<ApiErrorResponse> handleRecoveryInProgress(RecoveryInProgressException e) {
        return respond(error(HttpStatus.CONFLICT, "RECOVERY_IN_PROGRESS", e.getMessage()).build());
    }

    @ExceptionHandler(PolicyVersionConflictException.class)
    public ResponseEntity<ApiErrorResponse> handleVersionConflict(PolicyVersionConflictException e) {
        return respond(error(HttpStatus.CONFLICT, "VERSION_CONFLICT", e.getMessage())
                .currentVersion(e.getCurrentVersion())
                .build());
    }

    @ExceptionHandler(GovernanceValidationException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(GovernanceValidationException e) {
        return respond(error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", e.getMessage())
                .violations(e.getViolations())
                .build());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        List<String> violations = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .toList();
        return respond(error(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request body is invalid")
                .violations(violations)
                .build());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiErrorResponse> handleUnreadable(Exception e) {
        log.debug("[API] Unreadable request: {}", e.getMessage());
        return respond(error(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST", "Request could not be read").build());
    }

    @ExceptionHandler(ExternalDependencyException.class)
    public ResponseEntity<ApiErrorResponse> handleExternal(ExternalDependencyException e) {
        log.error("[API] External dependency failed: {}", e.getMessage(), e);
        return respond(error(HttpStatus.BAD_GATEWAY, "DEPENDENCY_FAILED", e.getMessage()).build());
    }

    @ExceptionHandler(OperationFailedException.class)
    public ResponseEntity<ApiErrorResponse> handleOperationFailed(OperationFailedException e) {
        log.error("[API] Monitored operation failed (failure {}): {}", e.getFailureId(), e.getMessage());
        return respond(error(HttpStatus.INTERNAL_SERVER_ERROR, "OPERATION_FAILED", e.getMessage()).build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse errorResponse) {
            // Spring MVC's own errors (unknown route, wrong method) keep their status
            HttpStatus status = HttpStatus.valueOf(errorResponse.getStatusCode().value());
            return respond(error(status, status.name(), e.getMessage()).build());
        }
        log.error("[API] Unhandled error: {}", e.getMessage(), e);
        return respond(error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error").build());
    }

    private static ApiErrorResponse.ApiErrorResponseBuilder error(HttpStatus status, String code, String message) {
        return ApiErrorResponse.builder()
                .status(status.value())
                .error(code)
                .message(message)
                .timestamp(Instant.now());
    }

    private static ResponseEntity<ApiErrorResponse> respond(ApiErrorResponse body) {
        return ResponseEntity.status(body.getStatus()).body(body);
    }
}
