package com.ai.voiceagent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Map;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthResponse {

    private String status;

    private String message;

    private String service;

    private String version;

    /** Feature name to availability, e.g. {@code completion_ai -> false} when no API key is set. */
    private Map<String, Boolean> features;

    @JsonProperty("active_calls")
    private Integer activeCalls;
}
