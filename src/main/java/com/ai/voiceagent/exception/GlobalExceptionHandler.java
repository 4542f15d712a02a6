package com.ai.voiceagent.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.UUID;

/**
 * Maps errors from the JSON endpoints to {@link ApiError} bodies. Twilio webhooks handle their own
 * failures and always answer with TwiML.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(TelephonyException.class)
    public ResponseEntity<ApiError> handleTelephony(TelephonyException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        HttpStatus status = ex.isConfigurationMissing() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR;
        log.error("Telephony error [{}]: {}", errorId, ex.getMessage(), ex);
        return build(status, errorId, ex.getErrorCode(), ex.getUserMessage(), request);
    }

    @ExceptionHandler(EmptyInputException.class)
    public ResponseEntity<ApiError> handleEmptyInput(EmptyInputException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Validation error [{}]: {}", errorId, ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, errorId, ex.getErrorCode(), ex.getUserMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.warn("Unreadable request body [{}]: {}", errorId, ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, errorId, ErrorCode.EMPTY_INPUT, "Request body is missing or malformed", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
        String errorId = generateErrorId();
        log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.builder()
                        .errorId(errorId)
                        .code("INTERNAL_001")
                        .message("An unexpected error occurred. Please try again later.")
                        .path(request.getRequestURI())
                        .timestamp(Instant.now())
                        .build());
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String errorId, ErrorCode code, String message,
                                           HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(ApiError.builder()
                        .errorId(errorId)
                        .code(code.getCode())
                        .message(message)
                        .path(request.getRequestURI())
                        .timestamp(Instant.now())
                        .build());
    }

    private String generateErrorId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
