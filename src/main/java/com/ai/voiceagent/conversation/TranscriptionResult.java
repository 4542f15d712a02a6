package com.ai.voiceagent.conversation;

import com.ai.voiceagent.exception.ErrorCode;

/**
 * Outcome of a speech capture: either recognized text or the reason there is none.
 */
public final class TranscriptionResult {

    private final String text;
    private final ErrorCode error;

    private TranscriptionResult(String text, ErrorCode error) {
        this.text = text;
        this.error = error;
    }

    public static TranscriptionResult recognized(String text) {
        return new TranscriptionResult(text, null);
    }

    public static TranscriptionResult noAudio() {
        return new TranscriptionResult(null, ErrorCode.NO_AUDIO_DETECTED);
    }

    public static TranscriptionResult unintelligible() {
        return new TranscriptionResult(null, ErrorCode.UNINTELLIGIBLE_AUDIO);
    }

    public static TranscriptionResult backendError() {
        return new TranscriptionResult(null, ErrorCode.RECOGNITION_BACKEND_ERROR);
    }

    public boolean isRecognized() {
        return error == null;
    }

    public String getText() {
        return text;
    }

    public ErrorCode getError() {
        return error;
    }
}
