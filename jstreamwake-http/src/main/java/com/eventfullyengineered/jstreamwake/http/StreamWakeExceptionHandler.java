package com.eventfullyengineered.jstreamwake.http;

import com.eventfullyengineered.jstreamwake.callbacks.CallbackException;
import com.eventfullyengineered.jstreamwake.callbacks.CallbackResponse;
import com.eventfullyengineered.jstreamwake.subscriptions.SubscriptionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps domain exceptions of both controllers to their JSON error bodies.
 */
@RestControllerAdvice(assignableTypes = {SubscriptionController.class, CallbackController.class})
public class StreamWakeExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(StreamWakeExceptionHandler.class);

    @ExceptionHandler(CallbackException.class)
    public ResponseEntity<CallbackResponse> callbackRejected(CallbackException e) {
        LOG.debug("Callback rejected with {}: {}", e.getCode(), e.getMessage());
        return ResponseEntity.status(e.getHttpStatus()).body(CallbackResponse.failure(e));
    }

    @ExceptionHandler(SubscriptionConflictException.class)
    public ResponseEntity<ErrorResponse> subscriptionConflict(SubscriptionConflictException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of("CONFLICT", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadableBody(HttpMessageNotReadableException e) {
        LOG.debug("Unreadable request body.", e);
        return ResponseEntity.badRequest().body(ErrorResponse.of("INVALID_REQUEST", "Malformed request body"));
    }
}
