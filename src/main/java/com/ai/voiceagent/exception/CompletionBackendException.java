package com.ai.voiceagent.exception;

/** Thrown when the remote completion backend is unavailable or fails to answer. */
public class CompletionBackendException extends AgentException {

    public CompletionBackendException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public CompletionBackendException(String message, Throwable cause) {
        super(ErrorCode.COMPLETION_BACKEND_ERROR, message, cause);
    }

    public static CompletionBackendException unavailable() {
        return new CompletionBackendException(ErrorCode.COMPLETION_BACKEND_UNAVAILABLE, "Completion backend is not initialized");
    }

    public boolean isUnavailable() {
        return getErrorCode() == ErrorCode.COMPLETION_BACKEND_UNAVAILABLE;
    }
}
