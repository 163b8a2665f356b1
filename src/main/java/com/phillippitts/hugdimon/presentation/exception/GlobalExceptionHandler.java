package com.phillippitts.hugdimon.presentation.exception;

import com.phillippitts.hugdimon.exception.ExternalServiceException;
import com.phillippitts.hugdimon.exception.InvalidTurnException;
import com.phillippitts.hugdimon.exception.SessionBusyException;
import com.phillippitts.hugdimon.exception.SessionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * User text never appears in logs or error bodies.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid turn input (HTTP 400).
     */
    @ExceptionHandler(InvalidTurnException.class)
    ResponseEntity<ApiError> handleInvalidTurn(InvalidTurnException ex) {
        LOG.warn("Invalid turn: field={}, reason={}", ex.getField(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getClass().getSimpleName());
        return error(HttpStatus.BAD_REQUEST, "MalformedRequest", "Invalid request",
                "Request body is not valid JSON for this endpoint");
    }

    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.info("Unknown conversation: {}", ex.getConversationId());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Conversation not found",
                "Start a new conversation without conversation_id");
    }

    /**
     * Another turn holds the conversation (HTTP 409). Retry after the current reply arrives.
     */
    @ExceptionHandler(SessionBusyException.class)
    ResponseEntity<ApiError> handleSessionBusy(SessionBusyException ex) {
        LOG.warn("Conversation busy: id={}, waited={}ms", ex.getConversationId(), ex.getWaited().toMillis());
        return error(HttpStatus.CONFLICT, ex.getClass().getSimpleName(), "Conversation is busy",
                "Another message for this conversation is still being processed");
    }

    /**
     * Collaborator unavailable at the boundary, e.g. voice turns without transcription (HTTP 503).
     */
    @ExceptionHandler(ExternalServiceException.class)
    ResponseEntity<ApiError> handleExternalService(ExternalServiceException ex) {
        LOG.error("External service failure: service={}, kind={}: {}", ex.getServiceName(), ex.getKind(),
                ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Service temporarily unavailable", "Please retry in a few seconds");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred",
                "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
