package com.ai.voiceagent.utils;

/**
 * Speaker of a conversation turn. The API role is the name the completion backend expects.
 */
public enum TurnRole {
    USER("user"),
    AGENT("assistant");

    private final String apiRole;

    TurnRole(String apiRole) {
        this.apiRole = apiRole;
    }

    public String getApiRole() {
        return apiRole;
    }
}
