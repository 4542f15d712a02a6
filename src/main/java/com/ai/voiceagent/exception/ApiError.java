package com.ai.voiceagent.exception;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/** Structured error body returned by the web API. */
@Getter
@Builder
public class ApiError {

    /** Short id that also appears in the log line. */
    private final String errorId;

    private final String code;

    private final String message;

    private final Instant timestamp;

    private final String path;
}
