package com.ai.voiceagent.exception;

/** Error taxonomy shared by the speech, completion and telephony adapters. */
public enum ErrorCode {
    NO_AUDIO_DETECTED("SPEECH_001", "No audio detected"),
    UNINTELLIGIBLE_AUDIO("SPEECH_002", "Could not understand audio"),
    RECOGNITION_BACKEND_ERROR("SPEECH_003", "Speech recognition service error"),
    COMPLETION_BACKEND_UNAVAILABLE("LLM_001", "AI service is not configured"),
    COMPLETION_BACKEND_ERROR("LLM_002", "AI service error"),
    SYNTHESIS_ERROR("TTS_001", "Text-to-speech failed"),
    TELEPHONY_CONFIGURATION_MISSING("TELEPHONY_001", "Twilio not configured"),
    TELEPHONY_CALL_FAILED("TELEPHONY_002", "Call could not be placed"),
    EMPTY_INPUT("VALIDATION_001", "Input cannot be empty");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
