package com.ai.voiceagent.exception;

/** Thrown by outbound calling when Twilio is not configured or rejects the call. */
public class TelephonyException extends AgentException {

    public TelephonyException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public TelephonyException(String message, Throwable cause) {
        super(ErrorCode.TELEPHONY_CALL_FAILED, message, cause);
    }

    public static TelephonyException notConfigured() {
        return new TelephonyException(ErrorCode.TELEPHONY_CONFIGURATION_MISSING, "Twilio credentials or origin number are not set");
    }

    public boolean isConfigurationMissing() {
        return getErrorCode() == ErrorCode.TELEPHONY_CONFIGURATION_MISSING;
    }
}
