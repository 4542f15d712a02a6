package com.ai.voiceagent.utils;

public enum CallDirection {
    INBOUND,
    OUTBOUND
}
