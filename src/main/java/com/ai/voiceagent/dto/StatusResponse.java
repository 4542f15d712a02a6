package com.ai.voiceagent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * {status, message, error?} body shared by the speak and reset endpoints.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatusResponse {

    private String status;

    private String message;

    private String error;

    public static StatusResponse success(String message) {
        return new StatusResponse("success", message, null);
    }

    public static StatusResponse error(String message, String error) {
        return new StatusResponse("error", message, error);
    }
}
