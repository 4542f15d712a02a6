package com.ai.voiceagent.exception;

/** Thrown when speech audio cannot be produced or played back. */
public class SynthesisException extends AgentException {

    public SynthesisException(String message) {
        super(ErrorCode.SYNTHESIS_ERROR, message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(ErrorCode.SYNTHESIS_ERROR, message, cause);
    }
}
